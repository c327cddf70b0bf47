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

package me.golemcore.termagent.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import me.golemcore.termagent.domain.exception.MalformedToolCallException;
import me.golemcore.termagent.domain.model.PlanStep;
import me.golemcore.termagent.domain.model.ResponseDefect;
import me.golemcore.termagent.domain.model.ToolInvocation;
import me.golemcore.termagent.domain.model.ToolName;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Turns one raw model reply into a typed {@link ToolInvocation}. Accepts
 * {@code {"tool": ..., "arguments": {...}}} as well as a flat object with the
 * arguments next to the tool name.
 */
@Component
@RequiredArgsConstructor
public class ToolCallParser {

    private static final String ARG_PATH = "path";
    private static final String ARG_COMMAND = "command";
    private static final String ARG_EXPLAIN = "explain";
    private static final String ARG_TIMEOUT = "timeout";
    private static final String ARG_CONTENT = "content";
    private static final String ARG_ACTION = "action";
    private static final String ARG_SEARCH = "search";
    private static final String ARG_REPLACE = "replace";
    private static final String ARG_LINE = "line";
    private static final String ARG_START_LINE = "start_line";
    private static final String ARG_END_LINE = "end_line";
    private static final String ARG_SOURCE = "source";
    private static final String ARG_DESTINATION = "destination";
    private static final String ARG_OVERWRITE = "overwrite";
    private static final String ARG_BACKUP = "backup";
    private static final String ARG_RECURSIVE = "recursive";
    private static final String ARG_PATTERN = "pattern";
    private static final String ARG_QUERY = "query";
    private static final String ARG_MAX_SOURCES = "max_sources";
    private static final String ARG_STEP = "step";
    private static final String ARG_STATUS = "status";
    private static final String ARG_RESULT = "result";
    private static final String ARG_QUESTION = "question";
    private static final String ARG_SUMMARY = "summary";

    private final LenientJsonParser jsonParser;

    public ToolInvocation parse(String raw) {
        JsonNode node = jsonParser.parse(raw).orElseThrow(() -> new MalformedToolCallException(
                ResponseDefect.Kind.MALFORMED_STRUCTURE, "the reply does not contain a JSON object"));
        if (node.isArray()) {
            if (node.size() != 1) {
                throw new MalformedToolCallException(ResponseDefect.Kind.MALFORMED_STRUCTURE,
                        "expected exactly one tool call per reply, got " + node.size());
            }
            node = node.get(0);
        }
        if (!node.isObject()) {
            throw new MalformedToolCallException(ResponseDefect.Kind.MALFORMED_STRUCTURE,
                    "the tool call must be a JSON object");
        }

        JsonNode toolNode = firstPresent(node, "tool", "name", "tool_name");
        if (toolNode == null || !toolNode.isTextual() || toolNode.asText().isBlank()) {
            throw new MalformedToolCallException(ResponseDefect.Kind.MISSING_ARGUMENT, "tool");
        }
        ToolName toolName = ToolName.fromWireName(toolNode.asText())
                .orElseThrow(() -> new MalformedToolCallException(ResponseDefect.Kind.UNKNOWN_TOOL,
                        "'" + toolNode.asText() + "'; valid tools are " + validToolNames()));

        JsonNode args = firstPresent(node, "arguments", "args", "parameters");
        if (args == null || !args.isObject()) {
            args = node;
        }
        return toInvocation(toolName, args);
    }

    private ToolInvocation toInvocation(ToolName toolName, JsonNode args) {
        return switch (toolName) {
        case EXECUTE_COMMAND -> new ToolInvocation.ExecuteCommand(
                requireText(args, ARG_COMMAND), optionalInt(args, ARG_TIMEOUT), optionalText(args, ARG_EXPLAIN));
        case READ_FILE -> new ToolInvocation.ReadFile(
                requireText(args, ARG_PATH), optionalInt(args, ARG_START_LINE), optionalInt(args, ARG_END_LINE));
        case WRITE_FILE -> new ToolInvocation.WriteFile(
                requireText(args, ARG_PATH), requirePresentText(args, ARG_CONTENT), optionalText(args, ARG_EXPLAIN));
        case EDIT_FILE -> parseEdit(args);
        case COPY_FILE -> new ToolInvocation.CopyFile(
                requireText(args, ARG_SOURCE), requireText(args, ARG_DESTINATION), optionalBool(args, ARG_OVERWRITE));
        case DELETE_FILE -> new ToolInvocation.DeleteFile(requireText(args, ARG_PATH), optionalBool(args, ARG_BACKUP));
        case LIST_DIRECTORY -> new ToolInvocation.ListDirectory(
                textOrDefault(args, ARG_PATH, "."), optionalBool(args, ARG_RECURSIVE), optionalText(args, ARG_PATTERN));
        case WEB_SEARCH -> new ToolInvocation.WebSearch(requireText(args, ARG_QUERY), optionalInt(args, ARG_MAX_SOURCES));
        case UPDATE_PLAN_STEP -> parseStepUpdate(args);
        case ASK_USER -> new ToolInvocation.AskUser(requireText(args, ARG_QUESTION));
        case FINISH -> new ToolInvocation.Finish(textOrDefault(args, ARG_SUMMARY, "Task reported as finished."));
        };
    }

    private ToolInvocation parseEdit(JsonNode args) {
        String path = requireText(args, ARG_PATH);
        String actionText = requireText(args, ARG_ACTION);
        ToolInvocation.EditAction action;
        try {
            action = ToolInvocation.EditAction.valueOf(actionText.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MalformedToolCallException(ResponseDefect.Kind.INVALID_ARGUMENT,
                    "action '" + actionText + "'; expected one of replace, insert_after, insert_before, delete_line");
        }
        String search = requireText(args, ARG_SEARCH);
        String replace = optionalText(args, ARG_REPLACE);
        String line = optionalText(args, ARG_LINE);
        if (action == ToolInvocation.EditAction.REPLACE && replace == null) {
            throw new MalformedToolCallException(ResponseDefect.Kind.MISSING_ARGUMENT, "replace (required by replace)");
        }
        if ((action == ToolInvocation.EditAction.INSERT_AFTER || action == ToolInvocation.EditAction.INSERT_BEFORE)
                && line == null) {
            throw new MalformedToolCallException(ResponseDefect.Kind.MISSING_ARGUMENT,
                    "line (required by " + action.wireName() + ")");
        }
        return new ToolInvocation.EditFile(path, action, search, replace, line, optionalText(args, ARG_EXPLAIN));
    }

    private ToolInvocation parseStepUpdate(JsonNode args) {
        JsonNode stepNode = firstPresent(args, ARG_STEP, "step_id", "step_number");
        if (stepNode == null || stepNode.isNull()) {
            throw new MalformedToolCallException(ResponseDefect.Kind.MISSING_ARGUMENT, ARG_STEP);
        }
        int stepId = toInt(stepNode, ARG_STEP);
        String statusText = requireText(args, ARG_STATUS);
        PlanStep.StepStatus status;
        try {
            status = PlanStep.StepStatus.fromWireName(statusText);
        } catch (IllegalArgumentException e) {
            throw new MalformedToolCallException(ResponseDefect.Kind.INVALID_ARGUMENT, "status '" + statusText
                    + "'; expected one of pending, in_progress, completed, failed, skipped");
        }
        String result = optionalText(args, ARG_RESULT);
        if (result == null) {
            result = optionalText(args, "notes");
        }
        return new ToolInvocation.UpdatePlanStep(stepId, status, result);
    }

    // ==================== Argument helpers ====================

    private static JsonNode firstPresent(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private static String requireText(JsonNode args, String name) {
        String value = optionalText(args, name);
        if (value == null || value.isBlank()) {
            throw new MalformedToolCallException(ResponseDefect.Kind.MISSING_ARGUMENT, name);
        }
        return value;
    }

    /**
     * Required but may be empty (file content).
     */
    private static String requirePresentText(JsonNode args, String name) {
        String value = optionalText(args, name);
        if (value == null) {
            throw new MalformedToolCallException(ResponseDefect.Kind.MISSING_ARGUMENT, name);
        }
        return value;
    }

    private static String optionalText(JsonNode args, String name) {
        JsonNode value = args.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private static String textOrDefault(JsonNode args, String name, String defaultValue) {
        String value = optionalText(args, name);
        return value == null || value.isBlank() ? defaultValue : value;
    }

    private static Integer optionalInt(JsonNode args, String name) {
        JsonNode value = args.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        return toInt(value, name);
    }

    private static int toInt(JsonNode value, String name) {
        if (value.isIntegralNumber()) {
            return value.asInt();
        }
        if (value.isTextual()) {
            try {
                return Integer.parseInt(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new MalformedToolCallException(ResponseDefect.Kind.INVALID_ARGUMENT,
                        name + " must be an integer, got '" + value.asText() + "'");
            }
        }
        throw new MalformedToolCallException(ResponseDefect.Kind.INVALID_ARGUMENT, name + " must be an integer");
    }

    private static boolean optionalBool(JsonNode args, String name) {
        JsonNode value = args.get(name);
        if (value == null || value.isNull()) {
            return false;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        String text = value.asText().trim().toLowerCase(Locale.ROOT);
        return "true".equals(text) || "yes".equals(text) || "1".equals(text);
    }

    private static String validToolNames() {
        return Arrays.stream(ToolName.values()).map(ToolName::wireName).collect(Collectors.joining(", "));
    }
}
