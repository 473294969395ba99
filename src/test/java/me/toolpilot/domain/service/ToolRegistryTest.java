package me.toolpilot.domain.service;

import me.toolpilot.domain.exception.ToolNotFoundException;
import me.toolpilot.domain.exception.ToolRegistrationException;
import me.toolpilot.domain.model.ToolDescriptor;
import me.toolpilot.domain.model.ToolParameter;
import me.toolpilot.domain.model.ToolPermission;
import me.toolpilot.testsupport.tools.StubTool;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolRegistryTest {

    private static final String FILES = "files";
    private static final String SYSTEM = "system";

    private static StubTool readFile() {
        return new StubTool("readFile", FILES, "r",
                ToolParameter.required("filepath", String.class, "Path"),
                ToolParameter.optional("max_lines", Integer.class, null, "Limit"));
    }

    private static StubTool writeFile() {
        return new StubTool("writeFile", FILES, "w",
                ToolParameter.required("filepath", String.class, "Path"),
                ToolParameter.required("content", String.class, "Text"),
                ToolParameter.optional("overwrite", Boolean.class, true, "Replace"));
    }

    // ==================== Schemas ====================

    @Test
    @SuppressWarnings("unchecked")
    void shouldListSchemasWithExactRequiredParameters() {
        ToolRegistry registry = ToolRegistry.builder()
                .register(readFile())
                .register(writeFile())
                .build();

        List<Map<String, Object>> schemas = registry.listSchemas();

        assertEquals(2, schemas.size());
        Map<String, Object> readParams = (Map<String, Object>) schemas.get(0).get("parameters");
        Map<String, Object> writeParams = (Map<String, Object>) schemas.get(1).get("parameters");
        assertEquals(List.of("filepath"), readParams.get("required"));
        assertEquals(List.of("filepath", "content"), writeParams.get("required"));
    }

    @Test
    void shouldReportRequiredAsParametersWithoutDefault() {
        ToolRegistry registry = ToolRegistry.builder().register(readFile()).register(writeFile()).build();

        for (ToolDescriptor descriptor : registry.getDescriptors()) {
            List<String> expected = descriptor.getDefinition().getParameters().stream()
                    .filter(ToolParameter::isRequired)
                    .map(ToolParameter::getName)
                    .toList();
            assertEquals(expected, registry.resolve(descriptor.getName()).getRequired());
        }
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldKeepDescriptorRequiredInSyncWithSchema() {
        ToolRegistry registry = ToolRegistry.builder().register(writeFile()).build();

        ToolDescriptor descriptor = registry.resolve("writeFile");
        Map<String, Object> parameters = (Map<String, Object>) descriptor.getSchema().get("parameters");

        assertEquals(List.of("filepath", "content"), descriptor.getRequired());
        assertEquals(descriptor.getRequired(), parameters.get("required"));
    }

    @Test
    void shouldReturnSameSchemasAcrossCalls() {
        ToolRegistry registry = ToolRegistry.builder().register(readFile()).build();

        assertSame(registry.listSchemas(), registry.listSchemas());
        assertEquals(registry.listSchemas().get(0), registry.buildSchema(registry.resolve("readFile")));
    }

    // ==================== Lookup ====================

    @Test
    void shouldResolveRegisteredTool() {
        StubTool tool = readFile();
        ToolRegistry registry = ToolRegistry.builder().register(tool).build();

        ToolDescriptor descriptor = registry.resolve("readFile");

        assertSame(tool, descriptor.getHandler());
        assertEquals(FILES, descriptor.getToolset());
        assertEquals(EnumSet.of(ToolPermission.READ), registry.getPermissions("readFile"));
    }

    @Test
    void shouldThrowNotFoundListingAvailableTools() {
        ToolRegistry registry = ToolRegistry.builder().register(readFile()).register(writeFile()).build();

        ToolNotFoundException error = assertThrows(ToolNotFoundException.class, () -> registry.resolve("nope"));

        assertEquals("nope", error.getToolName());
        assertEquals("Tool 'nope' not found. Available tools: readFile, writeFile", error.getMessage());
        assertTrue(registry.find("nope").isEmpty());
        assertTrue(registry.find("readFile").isPresent());
    }

    @Test
    void shouldTreatNullNameAsNotFound() {
        ToolRegistry registry = ToolRegistry.empty();

        assertThrows(ToolNotFoundException.class, () -> registry.resolve(null));
        assertTrue(registry.isEmpty());
    }

    // ==================== Registration ====================

    @Test
    void shouldRejectDuplicateNames() {
        ToolRegistry.Builder builder = ToolRegistry.builder().register(readFile());

        ToolRegistrationException error = assertThrows(ToolRegistrationException.class,
                () -> builder.register(readFile()));

        assertTrue(error.getMessage().contains("Duplicate tool name 'readFile'"));
    }

    @Test
    void shouldRejectDuplicateParameterNames() {
        StubTool tool = new StubTool("broken", FILES, "r",
                ToolParameter.required("path", String.class, "a"),
                ToolParameter.optional("path", String.class, null, "b"));

        assertThrows(ToolRegistrationException.class, () -> ToolRegistry.builder().register(tool));
    }

    @Test
    void shouldRejectBlankName() {
        StubTool tool = new StubTool(" ", FILES, "r");

        assertThrows(ToolRegistrationException.class, () -> ToolRegistry.builder().register(tool));
    }

    // ==================== Discovery ====================

    @Test
    void shouldDiscoverToolsetsInOrderAndSortToolsByName() {
        List<StubTool> candidates = List.of(
                new StubTool("runShellCode", SYSTEM, "x"),
                writeFile(),
                new StubTool("runJavaCode", SYSTEM, "x"),
                readFile());

        ToolRegistry registry = ToolRegistry.discover(List.of(SYSTEM, FILES), candidates);

        assertEquals(List.of("runJavaCode", "runShellCode", "readFile", "writeFile"), registry.getToolNames());
    }

    @Test
    void shouldIgnoreDisabledToolsAndOtherToolsets() {
        List<StubTool> candidates = List.of(
                readFile(),
                new StubTool("deleteFile", FILES, "w", false),
                new StubTool("getUrl", "web", "n"));

        ToolRegistry registry = ToolRegistry.discover(List.of(FILES, "missing"), candidates);

        assertEquals(List.of("readFile"), registry.getToolNames());
        assertEquals(1, registry.size());
    }

    @Test
    void shouldRejectDuplicatesAcrossToolsets() {
        List<StubTool> candidates = List.of(
                new StubTool("readFile", FILES, "r"),
                new StubTool("readFile", SYSTEM, "r"));

        assertThrows(ToolRegistrationException.class,
                () -> ToolRegistry.discover(List.of(FILES, SYSTEM), candidates));
    }
}
