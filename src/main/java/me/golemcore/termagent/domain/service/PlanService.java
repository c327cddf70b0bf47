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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.termagent.domain.exception.IncompletePlanException;
import me.golemcore.termagent.domain.exception.InvalidTransitionException;
import me.golemcore.termagent.domain.exception.PlanParseException;
import me.golemcore.termagent.domain.exception.UnknownStepException;
import me.golemcore.termagent.domain.exception.UnrecoverableResponseException;
import me.golemcore.termagent.domain.model.Message;
import me.golemcore.termagent.domain.model.Plan;
import me.golemcore.termagent.domain.model.PlanProgress;
import me.golemcore.termagent.domain.model.PlanStep;
import me.golemcore.termagent.domain.model.ResponseDefect;
import me.golemcore.termagent.infrastructure.config.AgentProperties;
import me.golemcore.termagent.port.outbound.LanguageModelPort;
import me.golemcore.termagent.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Plan manager: drafts plans with the model, owns step status transitions and
 * persists the plan after every change.
 *
 * <p>
 * Steps move only {@code pending -> in_progress -> completed|failed|skipped}.
 * Repeating the current status is a no-op. A plan is complete when every step
 * is resolved, failed and skipped steps included.
 */
@Service
@Slf4j
public class PlanService {

    static final String PLANS_DIR = "plans";
    private static final String[] DESCRIPTION_KEYS = { "description", "step", "title", "action", "task" };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final LenientJsonParser jsonParser;
    private final LanguageModelPort languageModel;
    private final PromptBuilder promptBuilder;
    private final int maxAttempts;
    private final Clock clock;

    public PlanService(StoragePort storagePort, ObjectMapper objectMapper, LenientJsonParser jsonParser,
            LanguageModelPort languageModel, PromptBuilder promptBuilder, AgentProperties properties, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.jsonParser = jsonParser;
        this.languageModel = languageModel;
        this.promptBuilder = promptBuilder;
        this.maxAttempts = Math.max(1, properties.getOrchestrator().getMaxValidationAttempts());
        this.clock = clock;
    }

    // ==================== Drafting ====================

    /**
     * Asks the model for a plan, re-asking with the parse error when the draft is
     * unusable.
     *
     * @throws UnrecoverableResponseException
     *             when no usable draft was produced within the attempt limit
     */
    public Plan generatePlan(String sessionId, String goal, List<Message> contextSnapshot) {
        String request = promptBuilder.planningRequest(goal);
        return draftWithRetries(contextSnapshot, request, draft -> createPlan(sessionId, goal, draft));
    }

    /**
     * Asks the model to rework a plan under review using the user's feedback.
     */
    public Plan regeneratePlan(Plan plan, String feedback, List<Message> contextSnapshot) {
        String request = promptBuilder.revisionRequest(plan, feedback);
        return draftWithRetries(contextSnapshot, request, draft -> revise(plan, feedback, draft));
    }

    private Plan draftWithRetries(List<Message> contextSnapshot, String request,
            Function<String, Plan> planFactory) {
        List<Message> messages = new ArrayList<>(contextSnapshot);
        messages.add(Message.user(request));
        PlanParseException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String draft = languageModel.sendAndWait(messages);
            try {
                return planFactory.apply(draft);
            } catch (PlanParseException e) {
                lastError = e;
                log.warn("[PlanManager] Draft {}/{} rejected: {}", attempt, maxAttempts, e.getMessage());
                messages.add(Message.assistant(draft));
                messages.add(Message.user(promptBuilder.planCorrection(e.getMessage())));
            }
        }
        throw new UnrecoverableResponseException(maxAttempts, new ResponseDefect(
                ResponseDefect.Kind.MALFORMED_STRUCTURE,
                "plan draft: " + (lastError != null ? lastError.getMessage() : "no draft")));
    }

    /**
     * Parses a model draft into a new plan with every step pending.
     *
     * @throws PlanParseException
     *             if the draft is empty or malformed
     */
    public Plan createPlan(String sessionId, String goal, String modelDraft) {
        List<PlanStep> steps = parseSteps(modelDraft);
        Instant now = clock.instant();
        Plan plan = Plan.builder()
                .sessionId(sessionId)
                .goal(goal)
                .steps(steps)
                .createdAt(now)
                .updatedAt(now)
                .build();
        log.info("[PlanManager] Created plan with {} step(s) for session {}", steps.size(), sessionId);
        persist(plan);
        return plan;
    }

    /**
     * Replaces the whole step sequence of a plan that is still under review.
     * Previous statuses are discarded.
     */
    public Plan revise(Plan plan, String userFeedback, String modelDraft) {
        if (plan.isAccepted()) {
            throw new IllegalStateException("Accepted plans cannot be revised");
        }
        List<PlanStep> steps = parseSteps(modelDraft);
        plan.setSteps(steps);
        plan.setRevision(plan.getRevision() + 1);
        plan.setUpdatedAt(clock.instant());
        log.info("[PlanManager] Revised plan (revision {}, {} step(s)) after feedback: {}", plan.getRevision(),
                steps.size(), userFeedback);
        persist(plan);
        return plan;
    }

    public void accept(Plan plan) {
        if (plan.getSteps().isEmpty()) {
            throw new IllegalStateException("Cannot accept an empty plan");
        }
        plan.setAccepted(true);
        plan.setUpdatedAt(clock.instant());
        persist(plan);
    }

    List<PlanStep> parseSteps(String modelDraft) {
        if (modelDraft == null || modelDraft.isBlank()) {
            throw new PlanParseException("the plan draft is empty");
        }
        JsonNode root = jsonParser.parse(modelDraft)
                .orElseThrow(() -> new PlanParseException("the plan draft is not valid JSON"));
        JsonNode items = root.isArray() ? root : root.get("steps");
        if (items == null && root.has("plan")) {
            items = root.get("plan");
        }
        if (items == null || !items.isArray()) {
            throw new PlanParseException("the plan draft has no \"steps\" array");
        }
        List<PlanStep> steps = new ArrayList<>();
        for (JsonNode item : items) {
            String description = describe(item);
            if (description == null || description.isBlank()) {
                throw new PlanParseException("step " + (steps.size() + 1) + " has no description");
            }
            String command = item.isObject() && item.hasNonNull("command") ? item.get("command").asText() : null;
            steps.add(PlanStep.builder()
                    .id(steps.size() + 1)
                    .description(description.trim())
                    .command(command == null || command.isBlank() ? null : command.trim())
                    .build());
        }
        if (steps.isEmpty()) {
            throw new PlanParseException("the plan draft contains no steps");
        }
        return steps;
    }

    private static String describe(JsonNode item) {
        if (item.isTextual()) {
            return item.asText();
        }
        if (!item.isObject()) {
            return null;
        }
        for (String key : DESCRIPTION_KEYS) {
            if (item.hasNonNull(key) && item.get(key).isTextual()) {
                return item.get(key).asText();
            }
        }
        return null;
    }

    // ==================== Step transitions ====================

    public Plan updateStep(Plan plan, int id, PlanStep.StepStatus newStatus) {
        return updateStep(plan, id, newStatus, null);
    }

    /**
     * Applies a status change to one step.
     *
     * @throws UnknownStepException
     *             if no step has the given id
     * @throws InvalidTransitionException
     *             if the step cannot move to the requested status
     */
    public Plan updateStep(Plan plan, int id, PlanStep.StepStatus newStatus, String result) {
        PlanStep step = plan.findStep(id)
                .orElseThrow(() -> new UnknownStepException(id, plan.getSteps().size()));
        PlanStep.StepStatus current = step.getStatus();
        if (current == newStatus) {
            log.debug("[PlanManager] Step {} already {}", id, current.wireName());
            return plan;
        }
        if (!current.canTransitionTo(newStatus)) {
            throw new InvalidTransitionException(id, current, newStatus);
        }
        Instant now = clock.instant();
        step.setStatus(newStatus);
        if (newStatus == PlanStep.StepStatus.IN_PROGRESS) {
            step.setStartedAt(now);
        }
        if (newStatus.isTerminal()) {
            step.setFinishedAt(now);
            if (result != null && !result.isBlank()) {
                step.setResult(result);
            }
        }
        plan.setUpdatedAt(now);
        log.info("[PlanManager] Step {}: {} -> {}", id, current.wireName(), newStatus.wireName());
        persist(plan);
        return plan;
    }

    /**
     * Marks the next pending step in progress when no step is active.
     */
    public Optional<PlanStep> startNextStepIfIdle(Plan plan) {
        if (plan.getActiveStep().isPresent()) {
            return Optional.empty();
        }
        Optional<PlanStep> next = plan.getNextPendingStep();
        next.ifPresent(step -> updateStep(plan, step.getId(), PlanStep.StepStatus.IN_PROGRESS));
        return next;
    }

    /**
     * Fails the active step, if any, with the given reason.
     */
    public Optional<PlanStep> failActiveStep(Plan plan, String reason) {
        if (plan == null) {
            return Optional.empty();
        }
        Optional<PlanStep> active = plan.getActiveStep();
        active.ifPresent(step -> updateStep(plan, step.getId(), PlanStep.StepStatus.FAILED, reason));
        return active;
    }

    // ==================== Completion ====================

    public boolean isComplete(Plan plan) {
        return plan.getSteps().stream().allMatch(PlanStep::isResolved);
    }

    /**
     * @throws IncompletePlanException
     *             listing the unresolved steps
     */
    public void assertComplete(Plan plan) {
        if (!isComplete(plan)) {
            throw new IncompletePlanException(plan.getUnresolvedSteps());
        }
    }

    public PlanProgress progressSummary(Plan plan) {
        int total = plan.getSteps().size();
        int completed = (int) plan.countByStatus(PlanStep.StepStatus.COMPLETED);
        int percentage = total == 0 ? 0 : completed * 100 / total;
        return new PlanProgress(completed,
                (int) plan.countByStatus(PlanStep.StepStatus.FAILED),
                (int) plan.countByStatus(PlanStep.StepStatus.SKIPPED),
                (int) plan.countByStatus(PlanStep.StepStatus.PENDING),
                (int) plan.countByStatus(PlanStep.StepStatus.IN_PROGRESS),
                total, percentage);
    }

    // ==================== Rendering ====================

    /**
     * Plan snapshot pinned into the model context.
     */
    public String renderForModel(Plan plan) {
        StringBuilder sb = new StringBuilder();
        sb.append("[Action plan]\n");
        for (PlanStep step : plan.getSteps()) {
            sb.append(marker(step.getStatus())).append(' ').append(step.getId()).append(". ")
                    .append(step.getDescription());
            if (step.getCommand() != null) {
                sb.append(" (command: ").append(step.getCommand()).append(')');
            }
            sb.append(" [").append(step.getStatus().wireName()).append(']');
            if (step.getResult() != null) {
                sb.append(" -> ").append(step.getResult());
            }
            sb.append('\n');
        }
        sb.append("Progress: ").append(progressSummary(plan).describe()).append('\n');
        plan.getActiveStep().ifPresent(step -> sb.append("Current step: ").append(step.getId()).append('\n'));
        plan.getNextPendingStep().ifPresent(step -> sb.append("Next pending step: ").append(step.getId()).append('\n'));
        return sb.toString();
    }

    public String renderForUser(Plan plan) {
        StringBuilder sb = new StringBuilder();
        for (PlanStep step : plan.getSteps()) {
            sb.append(String.format("%s %d. %s%n", marker(step.getStatus()), step.getId(), step.getDescription()));
            if (step.getCommand() != null) {
                sb.append("      $ ").append(step.getCommand()).append('\n');
            }
        }
        return sb.toString();
    }

    private static String marker(PlanStep.StepStatus status) {
        return switch (status) {
        case PENDING -> "[ ]";
        case IN_PROGRESS -> "[>]";
        case COMPLETED -> "[x]";
        case FAILED -> "[!]";
        case SKIPPED -> "[-]";
        };
    }

    // ==================== Persistence ====================

    public Optional<Plan> loadPlan(String sessionId) {
        try {
            String json = storagePort.getText(PLANS_DIR, fileName(sessionId)).join();
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, Plan.class));
        } catch (JsonProcessingException e) {
            log.warn("[PlanManager] Stored plan for session {} is unreadable", sessionId, e);
            return Optional.empty();
        }
    }

    private void persist(Plan plan) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(plan);
            storagePort.putTextAtomic(PLANS_DIR, fileName(plan.getSessionId()), json).join();
        } catch (Exception e) {
            log.error("[PlanManager] Failed to save plan for session {}", plan.getSessionId(), e);
            throw new IllegalStateException("Failed to persist plan", e);
        }
    }

    private static String fileName(String sessionId) {
        return sessionId + ".json";
    }
}
