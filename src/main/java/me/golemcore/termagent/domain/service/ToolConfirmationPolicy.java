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

import me.golemcore.termagent.domain.model.ExecutionMode;
import me.golemcore.termagent.domain.model.SecurityVerdict;
import me.golemcore.termagent.domain.model.ToolInvocation;
import org.springframework.stereotype.Component;

/**
 * Decides which tool calls need user approval before their effect runs, and
 * builds the descriptions shown in confirmation prompts.
 *
 * <p>
 * In confirm-each mode commands, file operations other than listing, and web
 * searches are confirmed. In autonomous mode only dangerous commands are. A
 * blocked verdict rejects the command without asking.
 */
@Component
public class ToolConfirmationPolicy {

    private static final int COMMAND_LENGTH_THRESHOLD = 400;
    private static final int CONTENT_PREVIEW_LENGTH = 300;

    public enum Requirement {
        NONE, CONFIRM, REJECT
    }

    /**
     * @param verdict
     *            security verdict for command invocations, ignored otherwise
     */
    public Requirement requirementFor(ToolInvocation invocation, ExecutionMode mode, SecurityVerdict verdict) {
        boolean confirmEach = mode == ExecutionMode.CONFIRM_EACH;
        return switch (invocation.toolName()) {
        case EXECUTE_COMMAND -> commandRequirement(verdict, confirmEach);
        case READ_FILE, WRITE_FILE, EDIT_FILE, COPY_FILE, DELETE_FILE, WEB_SEARCH ->
            confirmEach ? Requirement.CONFIRM : Requirement.NONE;
        case LIST_DIRECTORY, UPDATE_PLAN_STEP, ASK_USER, FINISH -> Requirement.NONE;
        };
    }

    private static Requirement commandRequirement(SecurityVerdict verdict, boolean confirmEach) {
        if (verdict == null) {
            throw new IllegalArgumentException("Command invocations need a security verdict");
        }
        return switch (verdict.tier()) {
        case BLOCKED -> Requirement.REJECT;
        case DANGEROUS -> Requirement.CONFIRM;
        case SAFE, CAUTION -> confirmEach ? Requirement.CONFIRM : Requirement.NONE;
        };
    }

    /**
     * Build a human-readable description of the action for the confirmation prompt.
     */
    public String describeAction(ToolInvocation invocation) {
        if (invocation instanceof ToolInvocation.ExecuteCommand command) {
            return "Run command: " + truncate(command.command(), COMMAND_LENGTH_THRESHOLD)
                    + explanation(command.explain());
        }
        if (invocation instanceof ToolInvocation.ReadFile read) {
            String range = read.startLine() != null || read.endLine() != null
                    ? " (lines " + orBlank(read.startLine()) + "-" + orBlank(read.endLine()) + ")"
                    : "";
            return "Read file: " + read.path() + range;
        }
        if (invocation instanceof ToolInvocation.WriteFile write) {
            return "Write file: " + write.path() + " (" + write.content().length() + " chars)"
                    + explanation(write.explain()) + "\n" + truncate(write.content(), CONTENT_PREVIEW_LENGTH);
        }
        if (invocation instanceof ToolInvocation.EditFile edit) {
            return "Edit file: " + edit.path() + " [" + edit.action().wireName() + "] matching '" + edit.search() + "'"
                    + explanation(edit.explain());
        }
        if (invocation instanceof ToolInvocation.CopyFile copy) {
            return "Copy " + copy.source() + " -> " + copy.destination() + (copy.overwrite() ? " (overwrite)" : "");
        }
        if (invocation instanceof ToolInvocation.DeleteFile delete) {
            return "Delete: " + delete.path() + (delete.backup() ? " (with backup)" : "");
        }
        if (invocation instanceof ToolInvocation.ListDirectory list) {
            return "List directory: " + list.path();
        }
        if (invocation instanceof ToolInvocation.WebSearch search) {
            return "Search the web for: " + search.query();
        }
        return invocation.toolName().wireName();
    }

    private static String explanation(String explain) {
        return explain == null || explain.isBlank() ? "" : "\nPurpose: " + explain;
    }

    private static String orBlank(Integer value) {
        return value == null ? "" : value.toString();
    }

    private static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }
}
