package me.toolpilot.adapter.outbound.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.toolpilot.domain.exception.ConfigurationException;
import me.toolpilot.domain.exception.ModelCommunicationException;
import me.toolpilot.domain.model.LlmRequest;
import me.toolpilot.domain.model.LlmResponse;
import me.toolpilot.domain.model.Message;
import me.toolpilot.infrastructure.config.AutoConfiguration;
import me.toolpilot.infrastructure.config.ToolPilotProperties;
import me.toolpilot.infrastructure.http.FeignClientFactory;
import me.toolpilot.testsupport.http.OkHttpMockEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenAiCompatibleLlmAdapterTest {

    private static final String API_KEY = "sk-test";
    private static final String MODEL = "gpt-test";

    private static final String FINAL_ANSWER_JSON = """
            {
              "id": "chatcmpl-1",
              "model": "gpt-test",
              "choices": [{
                "index": 0,
                "message": {"role": "assistant", "content": "Hello!"},
                "finish_reason": "stop"
              }],
              "usage": {"prompt_tokens": 12, "completion_tokens": 3, "total_tokens": 15}
            }
            """;

    private static final String TOOL_CALL_JSON = """
            {
              "model": "gpt-test",
              "choices": [{
                "message": {
                  "role": "assistant",
                  "content": null,
                  "tool_calls": [
                    {"id": "call_1", "type": "function",
                     "function": {"name": "readFile", "arguments": "{\\"filepath\\":\\"a.txt\\"}"}},
                    {"type": "function", "function": {"name": "listFiles", "arguments": "{}"}}
                  ]
                },
                "finish_reason": "tool_calls"
              }]
            }
            """;

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();
    private OkHttpMockEngine httpEngine;
    private ToolPilotProperties properties;
    private OpenAiCompatibleLlmAdapter adapter;

    @BeforeEach
    void setUp() {
        httpEngine = new OkHttpMockEngine();
        properties = new ToolPilotProperties();
        properties.getLlm().setBaseUrl("https://llm.test/v1/");
        properties.getLlm().setApiKey(API_KEY);
        properties.getLlm().setModel(MODEL);
        adapter = new OpenAiCompatibleLlmAdapter(properties,
                new FeignClientFactory(httpEngine.client(), objectMapper));
    }

    private static LlmRequest request(List<Message> messages, List<Map<String, Object>> tools) {
        return LlmRequest.builder()
                .model(MODEL)
                .messages(messages)
                .tools(tools)
                .temperature(0.2)
                .toolChoice("auto")
                .build();
    }

    // ==================== Request mapping ====================

    @Test
    void shouldPostChatCompletionWithBearerKey() throws IOException {
        httpEngine.enqueueJson(200, FINAL_ANSWER_JSON);
        Map<String, Object> schema = Map.of("name", "readFile", "description", "Read",
                "parameters", Map.of("type", "object", "properties", Map.of(), "required", List.of()));

        adapter.chat(request(List.of(Message.system("sys"), Message.user("hi")), List.of(schema)));

        OkHttpMockEngine.CapturedRequest captured = httpEngine.takeRequest();
        assertEquals("POST", captured.method());
        assertEquals("/v1/chat/completions", captured.target());
        assertEquals("Bearer " + API_KEY, captured.header("Authorization"));

        JsonNode body = objectMapper.readTree(captured.body());
        assertEquals(MODEL, body.get("model").asText());
        assertEquals(0.2, body.get("temperature").asDouble());
        assertEquals("auto", body.get("tool_choice").asText());
        assertEquals("system", body.get("messages").get(0).get("role").asText());
        assertEquals("hi", body.get("messages").get(1).get("content").asText());
        assertEquals("function", body.get("tools").get(0).get("type").asText());
        assertEquals("readFile", body.get("tools").get(0).get("function").get("name").asText());
    }

    @Test
    void shouldSerializeToolCallsAndToolResults() throws IOException {
        httpEngine.enqueueJson(200, FINAL_ANSWER_JSON);
        Message assistant = Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .toolCalls(List.of(Message.ToolCall.builder()
                        .id("call_1").name("readFile").arguments("{\"filepath\":\"a.txt\"}").build()))
                .build();
        Message tool = Message.builder()
                .role(Message.ROLE_TOOL)
                .toolCallId("call_1")
                .toolName("readFile")
                .content("{\"success\":true}")
                .build();

        adapter.chat(request(List.of(Message.user("read a.txt"), assistant, tool), List.of()));

        JsonNode messages = objectMapper.readTree(httpEngine.takeRequest().body()).get("messages");
        JsonNode toolCall = messages.get(1).get("tool_calls").get(0);
        assertEquals("call_1", toolCall.get("id").asText());
        assertEquals("function", toolCall.get("type").asText());
        assertEquals("{\"filepath\":\"a.txt\"}", toolCall.get("function").get("arguments").asText());
        assertFalse(messages.get(1).has("content"));
        assertEquals("call_1", messages.get(2).get("tool_call_id").asText());
    }

    @Test
    void shouldOmitToolsAndToolChoiceWhenNoToolsOffered() throws IOException {
        httpEngine.enqueueJson(200, FINAL_ANSWER_JSON);

        adapter.chat(request(List.of(Message.user("hi")), List.of()));

        JsonNode body = objectMapper.readTree(httpEngine.takeRequest().body());
        assertFalse(body.has("tools"));
        assertFalse(body.has("tool_choice"));
    }

    // ==================== Response mapping ====================

    @Test
    void shouldConvertFinalAnswer() {
        httpEngine.enqueueJson(200, FINAL_ANSWER_JSON);

        LlmResponse response = adapter.chat(request(List.of(Message.user("hi")), List.of()));

        assertEquals("Hello!", response.getContent());
        assertFalse(response.hasToolCalls());
        assertEquals("stop", response.getFinishReason());
        assertEquals(MODEL, response.getModel());
        assertEquals(12, response.getUsage().getInputTokens());
        assertEquals(3, response.getUsage().getOutputTokens());
        assertEquals(15, response.getUsage().getTotalTokens());
    }

    @Test
    void shouldConvertToolCallsKeepingRawArguments() {
        httpEngine.enqueueJson(200, TOOL_CALL_JSON);

        LlmResponse response = adapter.chat(request(List.of(Message.user("hi")), List.of()));

        assertTrue(response.hasToolCalls());
        assertNull(response.getContent());
        assertNull(response.getUsage());
        Message.ToolCall first = response.getToolCalls().get(0);
        assertEquals("call_1", first.getId());
        assertEquals("readFile", first.getName());
        assertEquals("{\"filepath\":\"a.txt\"}", first.getArguments());
        Message.ToolCall second = response.getToolCalls().get(1);
        assertNotNull(second.getId());
        assertTrue(second.getId().startsWith("call_"));
    }

    // ==================== Failures ====================

    @Test
    void shouldWrapHttpErrorStatus() {
        httpEngine.enqueueJson(401, "{\"error\":{\"message\":\"bad key\"}}");

        ModelCommunicationException error = assertThrows(ModelCommunicationException.class,
                () -> adapter.chat(request(List.of(Message.user("hi")), List.of())));

        assertTrue(error.getMessage().startsWith("Model endpoint returned HTTP 401"));
        assertTrue(error.getMessage().contains("bad key"));
    }

    @Test
    void shouldWrapTransportFailure() {
        httpEngine.enqueueFailure(new ConnectException("connection refused"));

        ModelCommunicationException error = assertThrows(ModelCommunicationException.class,
                () -> adapter.chat(request(List.of(Message.user("hi")), List.of())));

        assertTrue(error.getMessage().contains("connection refused"));
        assertEquals(1, httpEngine.getRequestCount());
    }

    @Test
    void shouldRejectResponseWithoutChoices() {
        httpEngine.enqueueJson(200, "{\"choices\":[]}");

        assertThrows(ModelCommunicationException.class,
                () -> adapter.chat(request(List.of(Message.user("hi")), List.of())));
    }

    @Test
    void shouldRejectMalformedJson() {
        httpEngine.enqueueJson(200, "not json");

        assertThrows(ModelCommunicationException.class,
                () -> adapter.chat(request(List.of(Message.user("hi")), List.of())));
    }

    // ==================== Configuration ====================

    @Test
    void shouldRequireKeyAndModel() {
        properties.getLlm().setApiKey(" ");

        assertFalse(adapter.isAvailable());
        assertThrows(ConfigurationException.class,
                () -> adapter.chat(request(List.of(Message.user("hi")), List.of())));
        assertEquals(0, httpEngine.getRequestCount());
    }

    @Test
    void shouldReportProviderAndModel() {
        assertEquals("openai", adapter.getProviderId());
        assertEquals(MODEL, adapter.getCurrentModel());
        assertTrue(adapter.isAvailable());
    }
}
