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

/**
 * A step status change that the step state machine does not allow.
 */
public class InvalidTransitionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int stepId;
    private final transient PlanStep.StepStatus from;
    private final transient PlanStep.StepStatus to;

    public InvalidTransitionException(int stepId, PlanStep.StepStatus from, PlanStep.StepStatus to) {
        super(buildMessage(stepId, from, to));
        this.stepId = stepId;
        this.from = from;
        this.to = to;
    }

    private static String buildMessage(int stepId, PlanStep.StepStatus from, PlanStep.StepStatus to) {
        String base = "Step " + stepId + " cannot move from " + from.wireName() + " to " + to.wireName();
        if (from.isTerminal()) {
            return base + ": the step is already resolved";
        }
        if (from == PlanStep.StepStatus.PENDING) {
            return base + ": mark it in_progress first";
        }
        return base;
    }

    public int getStepId() {
        return stepId;
    }

    public PlanStep.StepStatus getFrom() {
        return from;
    }

    public PlanStep.StepStatus getTo() {
        return to;
    }
}
