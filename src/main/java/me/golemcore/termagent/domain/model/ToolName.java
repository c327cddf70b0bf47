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

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of tools the model may call, with their wire names.
 */
public enum ToolName {
    EXECUTE_COMMAND("execute_command"),
    READ_FILE("read_file"),
    WRITE_FILE("write_file"),
    EDIT_FILE("edit_file"),
    COPY_FILE("copy_file"),
    DELETE_FILE("delete_file"),
    LIST_DIRECTORY("list_directory"),
    WEB_SEARCH("web_search"),
    UPDATE_PLAN_STEP("update_plan_step"),
    ASK_USER("ask_user"),
    FINISH("finish");

    private final String wireName;

    ToolName(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Whether the tool changes the world outside the session (commands, file
     * mutations, searches).
     */
    public boolean isEffectful() {
        return switch (this) {
        case EXECUTE_COMMAND, WRITE_FILE, EDIT_FILE, COPY_FILE, DELETE_FILE, WEB_SEARCH -> true;
        default -> false;
        };
    }

    public static Optional<ToolName> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if ("bash".equals(normalized) || "shell".equals(normalized)) {
            return Optional.of(EXECUTE_COMMAND);
        }
        return Arrays.stream(values()).filter(tool -> tool.wireName.equals(normalized)).findFirst();
    }
}
