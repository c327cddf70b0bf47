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

package me.golemcore.termagent.domain.exception;

import me.golemcore.termagent.domain.model.PlanStep;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when finishing is attempted while plan steps are still pending or in
 * progress.
 */
public class IncompletePlanException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient List<PlanStep> unresolvedSteps;

    public IncompletePlanException(List<PlanStep> unresolvedSteps) {
        super("Cannot finish: unresolved plan steps remain: " + unresolvedSteps.stream()
                .map(step -> step.getId() + " (" + step.getStatus().wireName() + ")")
                .collect(Collectors.joining(", "))
                + ". Resolve each step with update_plan_step (completed, failed or skipped) before calling finish.");
        this.unresolvedSteps = List.copyOf(unresolvedSteps);
    }

    public List<PlanStep> getUnresolvedSteps() {
        return unresolvedSteps;
    }
}
