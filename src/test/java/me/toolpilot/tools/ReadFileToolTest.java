package me.toolpilot.tools;

import me.toolpilot.domain.model.ToolFailureKind;
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

class ReadFileToolTest {

    @TempDir
    Path tempDir;

    private ReadFileTool readFile;
    private ReadFileLinesTool readFileLines;
    private ReadMultipleFilesTool readMultipleFiles;

    @BeforeEach
    void setUp() throws Exception {
        ToolPilotProperties properties = new ToolPilotProperties();
        properties.getTools().setWorkspace(tempDir.toString());
        readFile = new ReadFileTool(properties);
        readFileLines = new ReadFileLinesTool(properties);
        readMultipleFiles = new ReadMultipleFilesTool(properties);
        Files.writeString(tempDir.resolve("notes.txt"), "one\ntwo\nthree\nfour\n");
    }

    // ==================== readFile ====================

    @Test
    void shouldReadWholeFile() throws Exception {
        ToolResult result = readFile.execute(Map.of("filepath", "notes.txt")).get();

        assertTrue(result.isSuccess());
        assertEquals("one\ntwo\nthree\nfour\n", result.getData().get("content"));
        assertEquals(4, result.getData().get("lines_read"));
        assertEquals("notes.txt", result.getData().get("filepath"));
    }

    @Test
    void shouldReadFirstLinesOnly() throws Exception {
        ToolResult result = readFile.execute(Map.of("filepath", "notes.txt", "max_lines", 2)).get();

        assertEquals("one\ntwo", result.getData().get("content"));
        assertEquals(2, result.getData().get("lines_read"));
        assertEquals(2, result.getData().get("max_lines"));
    }

    @Test
    void shouldAcceptAbsolutePath() throws Exception {
        String absolute = tempDir.resolve("notes.txt").toString();

        assertTrue(readFile.execute(Map.of("filepath", absolute)).get().isSuccess());
    }

    @Test
    void shouldFailForMissingFile() throws Exception {
        ToolResult result = readFile.execute(Map.of("filepath", "missing.txt")).get();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertTrue(result.getError().startsWith("File does not exist"));
    }

    @Test
    void shouldFailForDirectory() throws Exception {
        Files.createDirectory(tempDir.resolve("dir"));

        ToolResult result = readFile.execute(Map.of("filepath", "dir")).get();

        assertTrue(result.getError().startsWith("Path is not a file"));
    }

    @Test
    void shouldCompleteExceptionallyWithoutFilepath() {
        ExecutionException error = assertThrows(ExecutionException.class,
                () -> readFile.execute(Map.of()).get());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }

    // ==================== readFileLines ====================

    @Test
    void shouldReadInclusiveLineRange() throws Exception {
        ToolResult result = readFileLines.execute(Map.of("filepath", "notes.txt", "from_line", 2, "to_line", 3))
                .get();

        assertTrue(result.isSuccess());
        assertEquals("two\nthree", result.getData().get("content"));
        assertEquals(2, result.getData().get("lines_read"));
        assertEquals(4, result.getData().get("total_lines"));
    }

    @Test
    void shouldClampRangeToFileEnd() throws Exception {
        ToolResult result = readFileLines.execute(Map.of("filepath", "notes.txt", "from_line", 3, "to_line", 99))
                .get();

        assertEquals("three\nfour", result.getData().get("content"));
        assertEquals(4, result.getData().get("to_line"));
    }

    @Test
    void shouldRejectStartBeyondFileEnd() throws Exception {
        ToolResult result = readFileLines.execute(Map.of("filepath", "notes.txt", "from_line", 10)).get();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.INVALID_ARGUMENTS, result.getFailureKind());
        assertEquals(4, result.getData().get("total_lines"));
    }

    @Test
    void shouldRejectInvertedRange() {
        ExecutionException error = assertThrows(ExecutionException.class,
                () -> readFileLines.execute(Map.of("filepath", "notes.txt", "from_line", 3, "to_line", 2)).get());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }

    @Test
    void shouldReadEmptyFileWithoutRange() throws Exception {
        Files.writeString(tempDir.resolve("empty.txt"), "");

        ToolResult result = readFileLines.execute(Map.of("filepath", "empty.txt")).get();

        assertTrue(result.isSuccess());
        assertEquals("", result.getData().get("content"));
        assertEquals(0, result.getData().get("lines_read"));
        assertEquals(0, result.getData().get("total_lines"));
    }

    @Test
    void shouldReadWholeFileWithoutRange() throws Exception {
        ToolResult result = readFileLines.execute(Map.of("filepath", "notes.txt")).get();

        assertEquals("one\ntwo\nthree\nfour", result.getData().get("content"));
        assertEquals(4, result.getData().get("to_line"));
    }

    // ==================== readMultipleFiles ====================

    @Test
    @SuppressWarnings("unchecked")
    void shouldReadExistingFilesAndReportMissingOnes() throws Exception {
        Files.writeString(tempDir.resolve("other.txt"), "alpha\nbeta\n");

        ToolResult result = readMultipleFiles.execute(
                Map.of("filepaths", "notes.txt, missing.txt,other.txt", "max_lines", 1)).get();

        assertTrue(result.isSuccess());
        assertEquals(3, result.getData().get("total_files"));
        assertEquals(2, result.getData().get("successful_files"));
        List<Map<String, Object>> files = (List<Map<String, Object>>) result.getData().get("files");
        assertEquals("notes.txt", files.get(0).get("filepath"));
        assertEquals(true, files.get(0).get("success"));
        assertEquals("one", files.get(0).get("content"));
        assertEquals("missing.txt", files.get(1).get("filepath"));
        assertEquals(false, files.get(1).get("success"));
        assertTrue(((String) files.get(1).get("error")).startsWith("File does not exist"));
        assertEquals("alpha", files.get(2).get("content"));
    }

    @Test
    void shouldFailWhenNoFileCanBeRead() throws Exception {
        ToolResult result = readMultipleFiles.execute(Map.of("filepaths", "missing.txt,gone.txt")).get();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertEquals(0, result.getData().get("successful_files"));
        assertEquals(2, result.getData().get("total_files"));
    }

    @Test
    void shouldRejectBlankFilepathList() {
        ExecutionException error = assertThrows(ExecutionException.class,
                () -> readMultipleFiles.execute(Map.of("filepaths", " , ")).get());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }
}
