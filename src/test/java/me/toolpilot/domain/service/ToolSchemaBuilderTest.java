package me.toolpilot.domain.service;

import me.toolpilot.domain.model.ToolDefinition;
import me.toolpilot.domain.model.ToolParameter;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class ToolSchemaBuilderTest {

    @Test
    void shouldMapDeclaredTypesToJsonTypes() {
        assertEquals("integer", ToolSchemaBuilder.jsonType(Integer.class));
        assertEquals("integer", ToolSchemaBuilder.jsonType(long.class));
        assertEquals("integer", ToolSchemaBuilder.jsonType(Short.class));
        assertEquals("integer", ToolSchemaBuilder.jsonType(byte.class));
        assertEquals("number", ToolSchemaBuilder.jsonType(Double.class));
        assertEquals("number", ToolSchemaBuilder.jsonType(float.class));
        assertEquals("number", ToolSchemaBuilder.jsonType(BigDecimal.class));
        assertEquals("boolean", ToolSchemaBuilder.jsonType(Boolean.class));
        assertEquals("string", ToolSchemaBuilder.jsonType(String.class));
        assertEquals("string", ToolSchemaBuilder.jsonType(List.class));
        assertEquals("string", ToolSchemaBuilder.jsonType(null));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldBuildObjectSchemaWithRequiredParametersOnly() {
        ToolDefinition definition = ToolDefinition.builder()
                .name("readFile")
                .description("Read a file.")
                .parameter(ToolParameter.required("filepath", String.class, "Path"))
                .parameter(ToolParameter.optional("max_lines", Integer.class, null, "Limit"))
                .parameter(ToolParameter.optional("strict", Boolean.class, false, null))
                .build();

        Map<String, Object> schema = ToolSchemaBuilder.build(definition);

        assertEquals("readFile", schema.get("name"));
        assertEquals("Read a file.", schema.get("description"));
        Map<String, Object> parameters = (Map<String, Object>) schema.get("parameters");
        assertEquals("object", parameters.get("type"));
        assertEquals(List.of("filepath"), parameters.get("required"));

        Map<String, Object> properties = (Map<String, Object>) parameters.get("properties");
        assertEquals(List.of("filepath", "max_lines", "strict"), List.copyOf(properties.keySet()));
        assertEquals(Map.of("type", "string", "description", "Path"), properties.get("filepath"));
        assertEquals("integer", ((Map<String, Object>) properties.get("max_lines")).get("type"));
        assertFalse(((Map<String, Object>) properties.get("strict")).containsKey("description"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldBuildEmptyParameterObjectForToolWithoutParameters() {
        ToolDefinition definition = ToolDefinition.builder().name("ping").build();

        Map<String, Object> schema = ToolSchemaBuilder.build(definition);

        Map<String, Object> parameters = (Map<String, Object>) schema.get("parameters");
        assertEquals(Map.of(), parameters.get("properties"));
        assertEquals(List.of(), parameters.get("required"));
        assertEquals("", schema.get("description"));
    }
}
