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

import java.util.Locale;

/**
 * A validated tool call. One nested record per {@link ToolName}, each carrying
 * the typed arguments of that tool.
 */
public interface ToolInvocation {

    ToolName toolName();

    record ExecuteCommand(String command, Integer timeoutSeconds, String explain) implements ToolInvocation {
        @Override
        public ToolName toolName() {
            return ToolName.EXECUTE_COMMAND;
        }
    }

    record ReadFile(String path, Integer startLine, Integer endLine) implements ToolInvocation {
        @Override
        public ToolName toolName() {
            return ToolName.READ_FILE;
        }
    }

    record WriteFile(String path, String content, String explain) implements ToolInvocation {
        @Override
        public ToolName toolName() {
            return ToolName.WRITE_FILE;
        }
    }

    record EditFile(String path, EditAction action, String search, String replace, String line, String explain)
            implements ToolInvocation {
        @Override
        public ToolName toolName() {
            return ToolName.EDIT_FILE;
        }
    }

    record CopyFile(String source, String destination, boolean overwrite) implements ToolInvocation {
        @Override
        public ToolName toolName() {
            return ToolName.COPY_FILE;
        }
    }

    record DeleteFile(String path, boolean backup) implements ToolInvocation {
        @Override
        public ToolName toolName() {
            return ToolName.DELETE_FILE;
        }
    }

    record ListDirectory(String path, boolean recursive, String pattern) implements ToolInvocation {
        @Override
        public ToolName toolName() {
            return ToolName.LIST_DIRECTORY;
        }
    }

    record WebSearch(String query, Integer maxSources) implements ToolInvocation {
        @Override
        public ToolName toolName() {
            return ToolName.WEB_SEARCH;
        }
    }

    record UpdatePlanStep(int stepId, PlanStep.StepStatus status, String result) implements ToolInvocation {
        @Override
        public ToolName toolName() {
            return ToolName.UPDATE_PLAN_STEP;
        }
    }

    record AskUser(String question) implements ToolInvocation {
        @Override
        public ToolName toolName() {
            return ToolName.ASK_USER;
        }
    }

    record Finish(String summary) implements ToolInvocation {
        @Override
        public ToolName toolName() {
            return ToolName.FINISH;
        }
    }

    /**
     * Line-oriented edit actions. Matching compares trimmed line text.
     */
    enum EditAction {
        REPLACE, INSERT_AFTER, INSERT_BEFORE, DELETE_LINE;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
