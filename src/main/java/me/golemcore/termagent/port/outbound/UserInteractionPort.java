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

package me.golemcore.termagent.port.outbound;

import me.golemcore.termagent.domain.model.ConfirmationDecision;
import me.golemcore.termagent.domain.model.Plan;
import me.golemcore.termagent.domain.model.PlanReviewDecision;
import me.golemcore.termagent.domain.model.SecurityVerdict;

import java.util.Optional;

/**
 * Port for the human side of a session. Every method blocks until the user
 * answers; end of input or an interrupt raises
 * {@link me.golemcore.termagent.domain.exception.UserInterruptException}.
 */
public interface UserInteractionPort {

    /**
     * Presents a proposed effect and asks for approval.
     *
     * @param description
     *            human-readable description of the effect
     * @param verdict
     *            security verdict for commands, {@code null} for other tools
     */
    ConfirmationDecision confirm(String description, SecurityVerdict verdict);

    /**
     * Asks why an effect was refused. The answer is passed to the model.
     */
    String requestJustification(String description);

    String ask(String question);

    /**
     * Reads one free-form line after the given label, without the agent
     * question framing. Used by the chat and prompt-creation modes.
     */
    String readInput(String label);

    PlanReviewDecision reviewPlan(Plan plan);

    boolean askYesNo(String question);

    /**
     * Asks for a follow-up goal; empty when the user is done.
     */
    Optional<String> requestNextGoal();

    void notify(String message);
}
