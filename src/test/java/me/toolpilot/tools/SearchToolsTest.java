package me.toolpilot.tools;

import me.toolpilot.domain.model.ToolResult;
import me.toolpilot.infrastructure.config.ToolPilotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SearchToolsTest {

    @TempDir
    Path tempDir;

    private SearchTextTool searchText;
    private SearchRegexTool searchRegex;

    @BeforeEach
    void setUp() throws Exception {
        ToolPilotProperties properties = new ToolPilotProperties();
        properties.getTools().setWorkspace(tempDir.toString());
        searchText = new SearchTextTool(properties);
        searchRegex = new SearchRegexTool(properties);

        Files.createDirectories(tempDir.resolve("src"));
        Files.createDirectories(tempDir.resolve(".git"));
        Files.writeString(tempDir.resolve("src/a.py"), "import os\n# TODO: fix\nprint('todo')\n");
        Files.writeString(tempDir.resolve("src/b.py"), "def main():\n    pass  # TODO later\n");
        Files.writeString(tempDir.resolve(".git/config"), "TODO hidden\n");
        Files.write(tempDir.resolve("src/blob.bin"), new byte[] {(byte) 0xC3, (byte) 0x28, 'T', 'O', 'D', 'O'});
    }

    @SuppressWarnings("unchecked")
    private static List<String> matches(ToolResult result) {
        return (List<String>) result.getData().get("matches");
    }

    // ==================== searchText ====================

    @Test
    void shouldFindCaseSensitiveMatchesWithLineNumbers() throws Exception {
        ToolResult result = searchText.execute(Map.of("paths", ".", "query", "TODO")).get();

        assertTrue(result.isSuccess());
        List<String> matches = matches(result);
        assertEquals(2, matches.size());
        assertTrue(matches.get(0).endsWith("a.py:2: # TODO: fix"));
        assertTrue(matches.get(1).endsWith("b.py:2:     pass  # TODO later"));
        assertEquals(false, result.getData().get("truncated"));
    }

    @Test
    void shouldMatchIgnoringCase() throws Exception {
        ToolResult result = searchText.execute(Map.of("paths", "src", "query", "todo", "case_sensitive", false))
                .get();

        assertEquals(3, matches(result).size());
    }

    @Test
    void shouldTruncateAtMaxResults() throws Exception {
        ToolResult result = searchText.execute(Map.of("paths", "src", "query", "o", "max_results", 1)).get();

        assertEquals(1, matches(result).size());
        assertEquals(true, result.getData().get("truncated"));
    }

    @Test
    void shouldCountAllMatchesWhenTruncated() throws Exception {
        ToolResult result = searchText.execute(Map.of("paths", "src", "query", "todo", "case_sensitive", false,
                "max_results", 2)).get();

        assertEquals(2, matches(result).size());
        assertEquals(3, result.getData().get("total_matches"));
        assertEquals(true, result.getData().get("truncated"));
        assertEquals(2, result.getData().get("files_searched"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldCountMatchesPerFile() throws Exception {
        ToolResult result = searchText.execute(Map.of("paths", "src/a.py src/b.py", "query", "TODO",
                "count_only", true)).get();

        Map<String, Integer> counts = (Map<String, Integer>) result.getData().get("counts");
        assertEquals(2, counts.size());
        assertEquals(2, result.getData().get("total_matches"));
        assertEquals(2, result.getData().get("files_searched"));
    }

    @Test
    void shouldSkipMissingPathsButFailWhenNoneRemain() throws Exception {
        ToolResult partial = searchText.execute(Map.of("paths", "missing src", "query", "import")).get();
        ToolResult none = searchText.execute(Map.of("paths", "missing", "query", "import")).get();

        assertTrue(partial.isSuccess());
        assertEquals(1, matches(partial).size());
        assertFalse(none.isSuccess());
    }

    // ==================== searchRegex ====================

    @Test
    void shouldMatchRegularExpression() throws Exception {
        ToolResult result = searchRegex.execute(Map.of("paths", "src", "pattern", "^def \\w+\\(")).get();

        List<String> matches = matches(result);
        assertEquals(1, matches.size());
        assertTrue(matches.get(0).endsWith("b.py:1: def main():"));
    }

    @Test
    void shouldRejectInvalidRegularExpression() {
        ExecutionException error = assertThrows(ExecutionException.class,
                () -> searchRegex.execute(Map.of("paths", "src", "pattern", "([a-")).get());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }
}
