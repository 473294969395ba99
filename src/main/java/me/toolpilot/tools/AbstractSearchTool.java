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

import me.toolpilot.domain.model.ToolResult;
import me.toolpilot.domain.service.ToolArguments;
import me.toolpilot.infrastructure.config.ToolPilotProperties;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Line-oriented search over files and directory trees.
 *
 * <p>
 * {@code paths} is a whitespace-separated list of files and directories.
 * Directories are searched recursively; hidden directories (such as
 * {@code .git}) and files that are not valid UTF-8 are skipped. Matches are
 * reported as {@code path:line: text}; at most {@code max_results} are listed
 * while {@code total_matches} counts all of them.
 */
@Slf4j
public abstract class AbstractSearchTool extends AbstractFileTool {

    protected AbstractSearchTool(ToolPilotProperties properties) {
        super(properties);
    }

    /**
     * Builds the line predicate from the bound arguments.
     */
    protected abstract Predicate<String> lineMatcher(ToolArguments arguments);

    @Override
    protected ToolResult run(ToolArguments arguments) throws IOException {
        String paths = arguments.getString("paths");
        Integer maxResults = arguments.getInteger("max_results");
        boolean countOnly = arguments.getBoolean("count_only");
        Predicate<String> matcher = lineMatcher(arguments);

        List<Path> roots = new ArrayList<>();
        for (String token : paths.trim().split("\\s+")) {
            if (token.isEmpty()) {
                continue;
            }
            Path root = resolvePath(token);
            if (Files.exists(root)) {
                roots.add(root);
            } else {
                log.warn("[{}] Path does not exist: {}", getToolName(), root);
            }
        }
        if (roots.isEmpty()) {
            return ToolResult.failure("No valid paths to search: " + paths);
        }

        int limit = maxResults != null && maxResults > 0 ? maxResults : Integer.MAX_VALUE;
        List<String> matches = new ArrayList<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        int totalMatches = 0;
        int filesSearched = 0;
        boolean truncated = false;

        for (Path root : roots) {
            for (Path file : collectFiles(root)) {
                List<String> lines = readLines(file);
                if (lines == null) {
                    continue;
                }
                filesSearched++;
                for (int i = 0; i < lines.size(); i++) {
                    if (!matcher.test(lines.get(i))) {
                        continue;
                    }
                    totalMatches++;
                    if (countOnly) {
                        counts.merge(file.toString(), 1, Integer::sum);
                        continue;
                    }
                    if (matches.size() < limit) {
                        matches.add(file + ":" + (i + 1) + ": " + lines.get(i));
                    } else {
                        truncated = true;
                    }
                }
            }
        }

        Map<String, Object> data = new LinkedHashMap<>();
        if (countOnly) {
            data.put("counts", counts);
            data.put("total_matches", totalMatches);
        } else {
            data.put("matches", matches);
            data.put("total_matches", totalMatches);
            data.put("truncated", truncated);
        }
        data.put("files_searched", filesSearched);
        return ToolResult.success(data);
    }

    private static List<Path> collectFiles(Path root) throws IOException {
        if (Files.isRegularFile(root)) {
            return List.of(root);
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> !isInHiddenDirectory(root, p))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static boolean isInHiddenDirectory(Path root, Path file) {
        Path relative = root.relativize(file);
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            if (relative.getName(i).toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    private List<String> readLines(Path file) throws IOException {
        if (Files.size(file) > MAX_FILE_SIZE) {
            log.debug("[{}] Skipping large file {}", getToolName(), file);
            return null;
        }
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (CharacterCodingException e) {
            log.debug("[{}] Skipping non-UTF-8 file {}", getToolName(), file);
            return null;
        }
        return lines;
    }
}
