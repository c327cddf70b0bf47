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

/**
 * Why a model response could not be turned into a tool invocation.
 */
public record ResponseDefect(Kind kind, String detail) {

    public enum Kind {
        MALFORMED_STRUCTURE, UNKNOWN_TOOL, MISSING_ARGUMENT, INVALID_ARGUMENT
    }

    public String describe() {
        return switch (kind) {
        case MALFORMED_STRUCTURE -> "Malformed tool call: " + detail;
        case UNKNOWN_TOOL -> "Unknown tool: " + detail;
        case MISSING_ARGUMENT -> "Missing required argument: " + detail;
        case INVALID_ARGUMENT -> "Invalid argument: " + detail;
        };
    }
}
