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
 * How effects proposed by the model are approved during a session.
 */
public enum ExecutionMode {

    /**
     * Every effect with a confirmation requirement is presented to the user first.
     */
    CONFIRM_EACH,

    /**
     * Effects run without prompting, except dangerous commands.
     */
    AUTONOMOUS;

    public static ExecutionMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return CONFIRM_EACH;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return switch (normalized) {
        case "confirm-each", "confirm" -> CONFIRM_EACH;
        case "autonomous", "auto" -> AUTONOMOUS;
        default -> throw new IllegalArgumentException("Unknown execution mode: " + value);
        };
    }
}
