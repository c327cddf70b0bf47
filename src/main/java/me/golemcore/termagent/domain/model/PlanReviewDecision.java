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
 * User verdict on a drafted plan.
 */
public record PlanReviewDecision(Action action, String feedback) {

    public enum Action {
        ACCEPT, REVISE, REJECT
    }

    public static PlanReviewDecision accept() {
        return new PlanReviewDecision(Action.ACCEPT, null);
    }

    public static PlanReviewDecision revise(String feedback) {
        return new PlanReviewDecision(Action.REVISE, feedback);
    }

    public static PlanReviewDecision reject() {
        return new PlanReviewDecision(Action.REJECT, null);
    }
}
