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

package me.golemcore.termagent.domain.loop;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.termagent.domain.exception.ExecutionBackendException;
import me.golemcore.termagent.domain.exception.LanguageModelException;
import me.golemcore.termagent.domain.exception.UnrecoverableResponseException;
import me.golemcore.termagent.domain.exception.UserInterruptException;
import me.golemcore.termagent.domain.model.AgentSession;
import me.golemcore.termagent.domain.model.AnalysisReport;
import me.golemcore.termagent.domain.model.ConversationContext;
import me.golemcore.termagent.domain.model.ExecutionTarget;
import me.golemcore.termagent.domain.model.Message;
import me.golemcore.termagent.domain.model.Plan;
import me.golemcore.termagent.domain.model.PlanReviewDecision;
import me.golemcore.termagent.domain.model.PlanStep;
import me.golemcore.termagent.domain.model.SessionOptions;
import me.golemcore.termagent.domain.model.SessionReport;
import me.golemcore.termagent.domain.model.SessionState;
import me.golemcore.termagent.domain.model.ToolFailureKind;
import me.golemcore.termagent.domain.model.ToolInvocation;
import me.golemcore.termagent.domain.model.ToolName;
import me.golemcore.termagent.domain.model.ToolResult;
import me.golemcore.termagent.domain.model.ValidatedResponse;
import me.golemcore.termagent.domain.service.ContextManager;
import me.golemcore.termagent.domain.service.DeepAnalysisAgent;
import me.golemcore.termagent.domain.service.PlanService;
import me.golemcore.termagent.domain.service.PromptBuilder;
import me.golemcore.termagent.domain.service.ResponseValidator;
import me.golemcore.termagent.domain.service.ToolDispatcher;
import me.golemcore.termagent.port.outbound.ExecutionBackendPort;
import me.golemcore.termagent.port.outbound.LanguageModelPort;
import me.golemcore.termagent.port.outbound.StoragePort;
import me.golemcore.termagent.port.outbound.UserInteractionPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Top-level session loop.
 *
 * <p>
 * States: {@code PLAN_PENDING -> PLAN_REVIEW -> EXECUTING -> FINISHED | ABORTED},
 * with review able to send the plan back for revision and a finished or aborted
 * goal able to continue with a new goal on the same context. Each executing
 * turn makes one model call and dispatches one tool call. The turn counter is
 * checked before the model is asked, so a limit of N allows exactly N turns.
 *
 * <p>
 * Unrecoverable failures (validation exhausted, model or backend failure, step
 * limit) abort the goal with a report; they never escape {@link #run}.
 *
 * <p>
 * {@link #cancel()} may be called from another thread (the Ctrl+C handler). It
 * interrupts the session thread; the current goal is aborted with a report, no
 * follow-up goal is requested and the remote connection is still closed.
 */
@Component
@Slf4j
public class AgentOrchestrator {

    static final String REPORTS_DIR = "reports";
    private static final int NOTIFY_PREVIEW_LENGTH = 300;

    private final PlanService planService;
    private final ContextManager contextManager;
    private final ResponseValidator responseValidator;
    private final ToolDispatcher toolDispatcher;
    private final DeepAnalysisAgent deepAnalysisAgent;
    private final PromptBuilder promptBuilder;
    private final LanguageModelPort languageModel;
    private final ExecutionBackendPort executionBackend;
    private final UserInteractionPort userInteraction;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private volatile Thread sessionThread;
    private volatile boolean cancelled;

    public AgentOrchestrator(PlanService planService, ContextManager contextManager,
            ResponseValidator responseValidator, ToolDispatcher toolDispatcher, DeepAnalysisAgent deepAnalysisAgent,
            PromptBuilder promptBuilder, LanguageModelPort languageModel, ExecutionBackendPort executionBackend,
            UserInteractionPort userInteraction, StoragePort storagePort, ObjectMapper objectMapper, Clock clock) {
        this.planService = planService;
        this.contextManager = contextManager;
        this.responseValidator = responseValidator;
        this.toolDispatcher = toolDispatcher;
        this.deepAnalysisAgent = deepAnalysisAgent;
        this.promptBuilder = promptBuilder;
        this.languageModel = languageModel;
        this.executionBackend = executionBackend;
        this.userInteraction = userInteraction;
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Runs a goal and any follow-up goals the user enters, returning one report
     * per goal.
     *
     * @throws ExecutionBackendException
     *             if the remote connection cannot be opened
     */
    public List<SessionReport> run(String goal, SessionOptions options) {
        cancelled = false;
        sessionThread = Thread.currentThread();
        try {
            return runOnTarget(goal, options);
        } finally {
            sessionThread = null;
        }
    }

    /**
     * Stops the running session at the next interruptible point.
     */
    public void cancel() {
        cancelled = true;
        Thread thread = sessionThread;
        if (thread != null) {
            log.info("[Orchestrator] Cancellation requested");
            thread.interrupt();
        }
    }

    public boolean isRunning() {
        return sessionThread != null;
    }

    private List<SessionReport> runOnTarget(String goal, SessionOptions options) {
        ExecutionTarget target = options.remoteHost() == null
                ? ExecutionTarget.local()
                : executionBackend.connect(options.remoteHost());
        AgentSession session = new AgentSession(UUID.randomUUID().toString(), goal, options.mode(),
                options.stepLimit(), target, clock.instant());
        log.info("[Orchestrator] Session {} started on {} in {} mode", session.getId(), target.describe(),
                options.mode());
        try {
            return runSession(session, options);
        } finally {
            // A cancellation that landed after the last interruptible point must not break the disconnect.
            Thread.interrupted();
            executionBackend.disconnect(target);
        }
    }

    List<SessionReport> runSession(AgentSession session, SessionOptions options) {
        ConversationContext context = session.getContext();
        contextManager.initialize(context, promptBuilder.systemPrompt(session),
                promptBuilder.goalMessage(session.getGoal()));
        List<SessionReport> reports = new ArrayList<>();
        while (true) {
            reports.add(runGoal(session, options));
            if (!options.continuationEnabled() || cancelled) {
                break;
            }
            Optional<String> nextGoal;
            try {
                nextGoal = userInteraction.requestNextGoal();
            } catch (UserInterruptException e) {
                log.info("[Orchestrator] Input closed, ending session {}", session.getId());
                break;
            }
            if (nextGoal.isEmpty()) {
                break;
            }
            session.continueWith(nextGoal.get());
            contextManager.addGoal(context, promptBuilder.continuationMessage(session.getGoal()));
            log.info("[Orchestrator] Continuing session {} with goal: {}", session.getId(), session.getGoal());
        }
        return reports;
    }

    SessionReport runGoal(AgentSession session, SessionOptions options) {
        try {
            planPhase(session, options);
            if (session.getState() == SessionState.EXECUTING) {
                executePhase(session);
            }
        } catch (UnrecoverableResponseException e) {
            abort(session, "the model kept producing invalid replies: " + e.getMessage());
        } catch (LanguageModelException e) {
            abort(session, "language model failure: " + e.getMessage());
        } catch (ExecutionBackendException e) {
            abort(session, "execution backend failure: " + e.getMessage());
        } catch (UserInterruptException e) {
            Thread.interrupted();
            abort(session, cancelled ? "interrupted by the user" : "interrupted by the user during planning");
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Unexpected failure in session {}", session.getId(), e);
            abort(session, "unexpected error: " + e.getMessage());
        }

        AnalysisReport analysis = maybeAnalyze(session, options);
        SessionReport report = buildReport(session, analysis);
        persistReport(report);
        userInteraction.notify(report.render());
        if (analysis != null) {
            userInteraction.notify(analysis.render());
        }
        return report;
    }

    // ==================== Planning ====================

    private void planPhase(AgentSession session, SessionOptions options) {
        ConversationContext context = session.getContext();
        List<Message> snapshot = contextManager.snapshot(context);
        Plan plan = planService.generatePlan(session.getId(), session.getGoal(), snapshot);
        session.setPlan(plan);
        session.transitionTo(SessionState.PLAN_REVIEW);

        while (!session.isAutonomous() && options.planReviewEnabled()) {
            PlanReviewDecision decision = userInteraction.reviewPlan(plan);
            if (decision.action() == PlanReviewDecision.Action.ACCEPT) {
                break;
            }
            if (decision.action() == PlanReviewDecision.Action.REJECT) {
                abort(session, "plan rejected by the user");
                return;
            }
            session.transitionTo(SessionState.PLAN_PENDING);
            plan = planService.regeneratePlan(plan, decision.feedback(), snapshot);
            session.setPlan(plan);
            session.transitionTo(SessionState.PLAN_REVIEW);
        }

        planService.accept(plan);
        contextManager.updatePlanSnapshot(context, planService.renderForModel(plan));
        session.transitionTo(SessionState.EXECUTING);
        userInteraction.notify("Plan accepted (" + plan.getSteps().size() + " step(s)):\n"
                + planService.renderForUser(plan));
        log.info("[Orchestrator] Plan accepted for session {} with {} step(s)", session.getId(),
                plan.getSteps().size());
    }

    // ==================== Execution ====================

    private void executePhase(AgentSession session) {
        ConversationContext context = session.getContext();
        while (session.getState() == SessionState.EXECUTING) {
            if (cancelled) {
                throw new UserInterruptException("Session cancelled");
            }
            int turn = session.nextStep();
            if (session.isStepLimitExceeded()) {
                abort(session, "step limit exceeded (" + session.getStepLimit() + ")");
                return;
            }
            contextManager.enforceWindow(context);
            List<Message> snapshot = contextManager.snapshot(context);
            String raw = languageModel.sendAndWait(snapshot);
            ValidatedResponse response = responseValidator.validate(raw, snapshot);
            ToolInvocation invocation = response.invocation();
            contextManager.appendAssistant(context, response.rawOutput().strip());
            log.info("[Orchestrator] Turn {}/{}: {}", turn, session.getStepLimit(), invocation.toolName().wireName());

            if (invocation.toolName().isEffectful()) {
                planService.startNextStepIfIdle(session.getPlan());
            }

            ToolResult result = dispatch(invocation, session);
            contextManager.appendToolResult(context, result);
            contextManager.updatePlanSnapshot(context, planService.renderForModel(session.getPlan()));
            userInteraction.notify(describeTurn(turn, result));

            if (invocation.toolName() == ToolName.FINISH && result.isSuccess()) {
                session.transitionTo(SessionState.FINISHED);
                log.info("[Orchestrator] Session {} finished after {} turn(s)", session.getId(), turn);
            }
        }
    }

    private ToolResult dispatch(ToolInvocation invocation, AgentSession session) {
        try {
            return toolDispatcher.dispatch(invocation, session);
        } catch (UserInterruptException e) {
            if (cancelled) {
                throw e;
            }
            Optional<PlanStep> failed = planService.failActiveStep(session.getPlan(), "interrupted by the user");
            log.info("[Orchestrator] {} interrupted by the user", invocation.toolName().wireName());
            String stepNote = failed.map(step -> " Step " + step.getId() + " was marked failed.").orElse("");
            return ToolResult.failure(invocation.toolName(), ToolFailureKind.INTERRUPTED,
                    "The user interrupted this action." + stepNote + " Continue with the remaining steps.");
        }
    }

    private static String describeTurn(int turn, ToolResult result) {
        String text = result.isSuccess() ? result.getOutput() : result.getError();
        text = text == null ? "" : text.strip();
        if (text.length() > NOTIFY_PREVIEW_LENGTH) {
            text = text.substring(0, NOTIFY_PREVIEW_LENGTH) + "...";
        }
        return String.format("[%d] %s %s%s", turn, result.getToolName().wireName(),
                result.isSuccess() ? "ok" : "failed", text.isEmpty() ? "" : ": " + text);
    }

    // ==================== Termination ====================

    private void abort(AgentSession session, String reason) {
        log.warn("[Orchestrator] Aborting session {}: {}", session.getId(), reason);
        Plan plan = session.getPlan();
        if (plan != null && session.getStoppedAt() == null) {
            session.setStoppedAt(plan.getActiveStep().or(plan::getNextPendingStep)
                    .map(step -> "step " + step.getId() + ": " + step.getDescription())
                    .orElse("after the last plan step"));
        }
        try {
            planService.failActiveStep(session.getPlan(), "aborted: " + reason);
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Could not record the failed step for session {}", session.getId(), e);
        }
        session.setAbortReason(reason);
        if (!session.isTerminal()) {
            session.transitionTo(SessionState.ABORTED);
        }
    }

    private AnalysisReport maybeAnalyze(AgentSession session, SessionOptions options) {
        if (session.getState() != SessionState.FINISHED) {
            return null;
        }
        String policy = options.deepAnalysis() == null ? "never" : options.deepAnalysis().toLowerCase(Locale.ROOT);
        boolean run = switch (policy) {
        case "always" -> true;
        case "ask" -> askForAnalysis();
        default -> false;
        };
        return run ? deepAnalysisAgent.analyze(session) : null;
    }

    private boolean askForAnalysis() {
        try {
            return userInteraction.askYesNo("Run a deep analysis of this session?");
        } catch (UserInterruptException e) {
            log.info("[Orchestrator] Analysis prompt interrupted, skipping analysis");
            return false;
        }
    }

    SessionReport buildReport(AgentSession session, AnalysisReport analysis) {
        Plan plan = session.getPlan();
        String stoppedAt = session.getState() == SessionState.ABORTED ? session.getStoppedAt() : null;
        return SessionReport.builder()
                .sessionId(session.getId())
                .goal(session.getGoal())
                .state(session.getState())
                .stepsUsed(Math.min(session.getStepCount(), session.getStepLimit()))
                .stepLimit(session.getStepLimit())
                .progress(plan != null ? planService.progressSummary(plan) : null)
                .summary(session.getFinishSummary())
                .abortReason(session.getAbortReason())
                .stoppedAt(stoppedAt)
                .commandsExecuted(session.getCommands().size())
                .fileOperations(session.getFileOperations().size())
                .analysis(analysis)
                .finishedAt(clock.instant())
                .build();
    }

    private void persistReport(SessionReport report) {
        String fileName = report.getSessionId() + "-" + report.getFinishedAt().toEpochMilli() + ".json";
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
            storagePort.putTextAtomic(REPORTS_DIR, fileName, json).join();
        } catch (Exception e) {
            log.warn("[Orchestrator] Failed to save report {}", fileName, e);
        }
    }
}
