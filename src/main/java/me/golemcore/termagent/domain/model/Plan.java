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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered action plan for one goal. Steps may be replaced as a whole until the
 * plan is accepted; afterwards only step statuses change.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Plan {

    private String sessionId;
    private String goal;

    @Builder.Default
    private List<PlanStep> steps = new ArrayList<>();

    private boolean accepted;
    private int revision;
    private Instant createdAt;
    private Instant updatedAt;

    @JsonIgnore
    public Optional<PlanStep> findStep(int id) {
        return steps.stream().filter(step -> step.getId() == id).findFirst();
    }

    /**
     * The step currently being worked on, if any.
     */
    @JsonIgnore
    public Optional<PlanStep> getActiveStep() {
        return steps.stream()
                .filter(step -> step.getStatus() == PlanStep.StepStatus.IN_PROGRESS)
                .findFirst();
    }

    @JsonIgnore
    public Optional<PlanStep> getNextPendingStep() {
        return steps.stream()
                .filter(step -> step.getStatus() == PlanStep.StepStatus.PENDING)
                .findFirst();
    }

    @JsonIgnore
    public List<PlanStep> getUnresolvedSteps() {
        return steps.stream().filter(step -> !step.isResolved()).toList();
    }

    @JsonIgnore
    public long countByStatus(PlanStep.StepStatus status) {
        return steps.stream().filter(step -> step.getStatus() == status).count();
    }
}
