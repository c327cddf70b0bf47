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

package me.golemcore.termagent.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.Locale;

/**
 * Result of a dispatched tool call. Results are fed back to the model as
 * tool-role messages.
 */
@Data
@Builder
public class ToolResult {

    private ToolName toolName;
    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String output;
    private Object data;
    private String error;
    private ToolFailureKind failureKind;

    public static ToolResult success(ToolName toolName, String output) {
        return ToolResult.builder()
                .toolName(toolName)
                .success(true)
                .output(output)
                .build();
    }

    public static ToolResult success(ToolName toolName, String output, Object data) {
        return ToolResult.builder()
                .toolName(toolName)
                .success(true)
                .output(output)
                .data(data)
                .build();
    }

    public static ToolResult failure(ToolName toolName, ToolFailureKind kind, String error) {
        return ToolResult.builder()
                .toolName(toolName)
                .success(false)
                .failureKind(kind)
                .error(error)
                .build();
    }

    public static ToolResult failure(ToolName toolName, ToolFailureKind kind, String error, Object data) {
        return ToolResult.builder()
                .toolName(toolName)
                .success(false)
                .failureKind(kind)
                .error(error)
                .data(data)
                .build();
    }

    /**
     * Text sent back to the model for this result.
     */
    public String toMessageContent() {
        String name = toolName != null ? toolName.wireName() : "tool";
        if (success) {
            return "[" + name + " succeeded]\n" + (output != null ? output : "");
        }
        String kind = failureKind != null ? " (" + failureKind.name().toLowerCase(Locale.ROOT) + ")" : "";
        StringBuilder sb = new StringBuilder("[" + name + " failed" + kind + "]\n");
        sb.append(error != null ? error : "unknown error");
        if (output != null && !output.isBlank()) {
            sb.append("\n").append(output);
        }
        return sb.toString();
    }
}
