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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;

/**
 * A single step of an action plan. Identifiers are stable integers starting at
 * 1 in plan order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanStep {

    private int id;
    private String description;
    private String command;

    @Builder.Default
    private StepStatus status = StepStatus.PENDING;

    private String result;
    private Instant startedAt;
    private Instant finishedAt;

    @JsonIgnore
    public boolean isResolved() {
        return status.isTerminal();
    }

    /**
     * Step execution states. Terminal states accept no further transition.
     */
    public enum StepStatus {
        PENDING, IN_PROGRESS, COMPLETED, FAILED, SKIPPED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED || this == SKIPPED;
        }

        public boolean canTransitionTo(StepStatus next) {
            return switch (this) {
            case PENDING -> next == IN_PROGRESS;
            case IN_PROGRESS -> next.isTerminal();
            case COMPLETED, FAILED, SKIPPED -> false;
            };
        }

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static StepStatus fromWireName(String value) {
            if (value == null) {
                throw new IllegalArgumentException("Step status is required");
            }
            String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
            if ("DONE".equals(normalized)) {
                return COMPLETED;
            }
            try {
                return StepStatus.valueOf(normalized);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown step status: " + value, e);
            }
        }
    }
}
