package me.toolpilot.tools;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.toolpilot.domain.model.ToolDefinition;
import me.toolpilot.domain.model.ToolFailureKind;
import me.toolpilot.domain.model.ToolParameter;
import me.toolpilot.domain.model.ToolPermission;
import me.toolpilot.domain.model.ToolResult;
import me.toolpilot.domain.service.ToolArguments;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Fetches the body of an HTTP(S) URL as text.
 *
 * <p>
 * The body is cut to {@code max_length} characters first and then to
 * {@code max_lines} lines; each cut appends a {@code "... [truncated]"}
 * marker. Only as many bytes as the length limit needs are read from the
 * body. Non-2xx responses are failures carrying the status code.
 */
@Component
@Slf4j
public class GetUrlTool extends AbstractTool {

    static final String TRUNCATED_MARKER = "... [truncated]";
    private static final String USER_AGENT = "Mozilla/5.0 (compatible; ToolPilot/1.0)";
    private static final int DEFAULT_TIMEOUT = 10;
    static final int MAX_BODY_BYTES = 10 * 1024 * 1024;

    private static final ToolDefinition DEFINITION = ToolDefinition.builder()
            .name("getUrl")
            .description("Fetch the content of an http:// or https:// URL.")
            .toolset("web")
            .permissions(ToolPermission.parse("n"))
            .parameter(ToolParameter.required("url", String.class, "URL to fetch"))
            .parameter(ToolParameter.optional("max_length", Integer.class, 5000,
                    "Maximum number of characters to return"))
            .parameter(ToolParameter.optional("max_lines", Integer.class, 200,
                    "Maximum number of lines to return"))
            .parameter(ToolParameter.optional("timeout", Integer.class, DEFAULT_TIMEOUT,
                    "Request timeout in seconds"))
            .parameter(ToolParameter.optional("follow_redirects", Boolean.class, true,
                    "Follow HTTP redirects"))
            .build();

    private final OkHttpClient baseHttpClient;

    public GetUrlTool(OkHttpClient baseHttpClient) {
        this.baseHttpClient = baseHttpClient;
    }

    @Override
    public ToolDefinition getDefinition() {
        return DEFINITION;
    }

    @Override
    protected ToolResult run(ToolArguments arguments) throws IOException {
        String url = arguments.getString("url").trim();
        Integer maxLength = arguments.getInteger("max_length");
        Integer maxLines = arguments.getInteger("max_lines");
        Integer timeout = arguments.getInteger("timeout");
        int timeoutSeconds = timeout != null && timeout > 0 ? timeout : DEFAULT_TIMEOUT;

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("url", url);
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                    "URL must start with http:// or https://", data);
        }

        OkHttpClient client = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .followRedirects(arguments.getBoolean("follow_redirects"))
                .followSslRedirects(arguments.getBoolean("follow_redirects"))
                .build();
        Request request = new Request.Builder()
                .url(url)
                .header("User-Agent", USER_AGENT)
                .get()
                .build();

        long started = System.nanoTime();
        try (Response response = client.newCall(request).execute()) {
            data.put("status_code", response.code());
            if (!response.isSuccessful()) {
                data.put("execution_time_ms", elapsedMillis(started));
                log.warn("[getUrl] {} returned HTTP {}", url, response.code());
                return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                        "HTTP Error " + response.code() + ": " + response.message(), data);
            }
            ResponseBody body = response.body();
            byte[] bytes = body != null ? readBounded(body, byteLimit(maxLength)) : new byte[0];
            String content = new String(bytes, charsetOf(body));
            String limited = limit(content, maxLength, maxLines);
            long declaredLength = body != null ? body.contentLength() : -1;

            data.put("content", limited);
            data.put("content_length", declaredLength >= 0 ? (int) Math.min(declaredLength, Integer.MAX_VALUE)
                    : bytes.length);
            data.put("lines_returned", limited.split("\n", -1).length);
            data.put("execution_time_ms", elapsedMillis(started));
            log.info("[getUrl] Fetched {} ({} chars)", url, content.length());
            return ToolResult.success(data);
        }
    }

    /**
     * Bytes to read for a {@code max_length} character limit: enough for one
     * character past the limit at four bytes per character.
     */
    static int byteLimit(Integer maxLength) {
        if (maxLength == null || maxLength < 0) {
            return MAX_BODY_BYTES;
        }
        return (int) Math.min((long) maxLength * 4 + 4, MAX_BODY_BYTES);
    }

    private static byte[] readBounded(ResponseBody body, int limit) throws IOException {
        try (InputStream stream = body.byteStream()) {
            return stream.readNBytes(limit);
        }
    }

    private static Charset charsetOf(ResponseBody body) {
        MediaType contentType = body != null ? body.contentType() : null;
        return contentType != null ? contentType.charset(StandardCharsets.UTF_8) : StandardCharsets.UTF_8;
    }

    static String limit(String content, Integer maxLength, Integer maxLines) {
        String result = content;
        if (maxLength != null && maxLength >= 0 && result.length() > maxLength) {
            result = result.substring(0, maxLength) + TRUNCATED_MARKER;
        }
        if (maxLines != null && maxLines >= 0) {
            String[] lines = result.split("\n", -1);
            if (lines.length > maxLines) {
                StringBuilder sb = new StringBuilder();
                for (int i = 0; i < maxLines; i++) {
                    sb.append(lines[i]).append('\n');
                }
                result = sb.append(TRUNCATED_MARKER).toString();
            }
        }
        return result;
    }

    private static long elapsedMillis(long started) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    }
}
