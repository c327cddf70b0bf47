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

package me.golemcore.termagent.adapter.outbound.file;

import me.golemcore.termagent.domain.exception.FileOperationException;
import me.golemcore.termagent.domain.model.ToolInvocation.EditAction;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented text transformations shared by the local and remote file
 * backends. Lines match when they are equal after trimming.
 */
final class LineEditor {

    private LineEditor() {
    }

    static List<String> splitLines(String content) {
        List<String> lines = new ArrayList<>(List.of(content.split("\n", -1)));
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    /**
     * Returns lines {@code startLine..endLine}, 1-based and inclusive. Missing
     * bounds default to the start and end of the file.
     */
    static String slice(String content, Integer startLine, Integer endLine) {
        if (startLine == null && endLine == null) {
            return content;
        }
        List<String> lines = splitLines(content);
        int start = startLine == null ? 1 : startLine;
        int end = endLine == null ? lines.size() : Math.min(endLine, lines.size());
        if (start < 1 || (endLine != null && endLine < start)) {
            throw new FileOperationException("Invalid line range " + start + ".." + endLine);
        }
        if (start > lines.size()) {
            return "";
        }
        return String.join("\n", lines.subList(start - 1, end)) + "\n";
    }

    static int countLines(String content) {
        return splitLines(content).size();
    }

    /**
     * Applies the edit to every matching line.
     *
     * @throws FileOperationException
     *             if no line matches {@code search}
     */
    static Edit apply(String content, EditAction action, String search, String replace, String line) {
        String needle = search.strip();
        List<String> out = new ArrayList<>();
        int matches = 0;
        for (String current : splitLines(content)) {
            if (!current.strip().equals(needle)) {
                out.add(current);
                continue;
            }
            matches++;
            switch (action) {
            case REPLACE -> out.add(replace);
            case INSERT_AFTER -> {
                out.add(current);
                out.add(line);
            }
            case INSERT_BEFORE -> {
                out.add(line);
                out.add(current);
            }
            case DELETE_LINE -> {
                // dropped
            }
            }
        }
        if (matches == 0) {
            throw new FileOperationException("No line matching '" + needle + "' was found");
        }
        String joined = out.isEmpty() ? "" : String.join("\n", out) + "\n";
        return new Edit(joined, matches);
    }

    record Edit(String content, int matchedLines) {
    }
}
