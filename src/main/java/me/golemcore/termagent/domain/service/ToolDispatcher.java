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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.termagent.domain.exception.FileOperationException;
import me.golemcore.termagent.domain.exception.IncompletePlanException;
import me.golemcore.termagent.domain.exception.InvalidTransitionException;
import me.golemcore.termagent.domain.exception.UnknownStepException;
import me.golemcore.termagent.domain.model.AgentSession;
import me.golemcore.termagent.domain.model.CommandRecord;
import me.golemcore.termagent.domain.model.CommandResult;
import me.golemcore.termagent.domain.model.ConfirmationDecision;
import me.golemcore.termagent.domain.model.ExecutionTarget;
import me.golemcore.termagent.domain.model.FileOperationRecord;
import me.golemcore.termagent.domain.model.Plan;
import me.golemcore.termagent.domain.model.PlanStep;
import me.golemcore.termagent.domain.model.SearchReport;
import me.golemcore.termagent.domain.model.SecurityVerdict;
import me.golemcore.termagent.domain.model.ToolFailureKind;
import me.golemcore.termagent.domain.model.ToolInvocation;
import me.golemcore.termagent.domain.model.ToolName;
import me.golemcore.termagent.domain.model.ToolResult;
import me.golemcore.termagent.infrastructure.config.AgentProperties;
import me.golemcore.termagent.port.outbound.ExecutionBackendPort;
import me.golemcore.termagent.port.outbound.FileOperatorPort;
import me.golemcore.termagent.port.outbound.UserInteractionPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Maps a validated tool invocation to its effect. Applies the confirmation
 * protocol first: a refused effect is never run and the user's justification
 * goes back to the model as a failed result. Component errors (unknown step,
 * invalid transition, file errors, finishing too early) come back as failed
 * results too.
 *
 * <p>
 * Propagates only {@link me.golemcore.termagent.domain.exception.UserInterruptException}
 * and {@link me.golemcore.termagent.domain.exception.ExecutionBackendException}.
 */
@Service
@Slf4j
public class ToolDispatcher {

    private static final int OUTPUT_SAMPLE_LENGTH = 2000;
    private static final int MAX_RESULT_SOURCES = 3;
    private static final int SOURCE_EXCERPT_LENGTH = 1500;

    private final SecurityGate securityGate;
    private final ToolConfirmationPolicy confirmationPolicy;
    private final PlanService planService;
    private final ExecutionBackendPort executionBackend;
    private final FileOperatorPort fileOperator;
    private final WebSearchAgent webSearchAgent;
    private final UserInteractionPort userInteraction;
    private final AgentProperties.ExecutionProperties executionProperties;
    private final Clock clock;

    public ToolDispatcher(SecurityGate securityGate, ToolConfirmationPolicy confirmationPolicy,
            PlanService planService, ExecutionBackendPort executionBackend, FileOperatorPort fileOperator,
            WebSearchAgent webSearchAgent, UserInteractionPort userInteraction, AgentProperties properties,
            Clock clock) {
        this.securityGate = securityGate;
        this.confirmationPolicy = confirmationPolicy;
        this.planService = planService;
        this.executionBackend = executionBackend;
        this.fileOperator = fileOperator;
        this.webSearchAgent = webSearchAgent;
        this.userInteraction = userInteraction;
        this.executionProperties = properties.getExecution();
        this.clock = clock;
    }

    public ToolResult dispatch(ToolInvocation invocation, AgentSession session) {
        SecurityVerdict verdict = invocation instanceof ToolInvocation.ExecuteCommand command
                ? securityGate.classify(command.command())
                : null;
        if (verdict != null) {
            log.debug("[Security] {} -> {} ({})", invocation, verdict.tier(), verdict.rationale());
        }

        switch (confirmationPolicy.requirementFor(invocation, session.getMode(), verdict)) {
        case REJECT -> {
            log.warn("[Dispatcher] Rejected {}: {}", invocation.toolName().wireName(), verdict.rationale());
            return ToolResult.failure(invocation.toolName(), ToolFailureKind.POLICY_DENIED,
                    "Command blocked: " + verdict.rationale()
                            + ". Do not retry commands; continue with other tools or resolve the remaining steps.");
        }
        case CONFIRM -> {
            Optional<ToolResult> refusal = confirm(invocation, session, verdict);
            if (refusal.isPresent()) {
                return refusal.get();
            }
        }
        case NONE -> log.debug("[Dispatcher] No confirmation needed for {}", invocation.toolName().wireName());
        }

        return execute(invocation, session);
    }

    private Optional<ToolResult> confirm(ToolInvocation invocation, AgentSession session, SecurityVerdict verdict) {
        String description = confirmationPolicy.describeAction(invocation);
        log.info("[Dispatcher] Requesting confirmation: {}", description.lines().findFirst().orElse(""));
        ConfirmationDecision decision = userInteraction.confirm(description, verdict);
        switch (decision) {
        case APPROVE -> {
            return Optional.empty();
        }
        case APPROVE_ALL -> {
            session.switchToAutonomous();
            log.info("[Dispatcher] Session {} switched to autonomous mode", session.getId());
            return Optional.empty();
        }
        case DENY -> {
            String justification = userInteraction.requestJustification(description);
            log.info("[Dispatcher] User refused {}: {}", invocation.toolName().wireName(), justification);
            String reason = justification == null || justification.isBlank() ? "no reason given" : justification;
            return Optional.of(ToolResult.failure(invocation.toolName(), ToolFailureKind.CONFIRMATION_DENIED,
                    "The user refused this action and it was not executed. Justification: " + reason));
        }
        default -> throw new IllegalStateException("Unhandled decision " + decision);
        }
    }

    private ToolResult execute(ToolInvocation invocation, AgentSession session) {
        return switch (invocation.toolName()) {
        case EXECUTE_COMMAND -> executeCommand((ToolInvocation.ExecuteCommand) invocation, session);
        case READ_FILE -> readFile((ToolInvocation.ReadFile) invocation, session);
        case WRITE_FILE -> writeFile((ToolInvocation.WriteFile) invocation, session);
        case EDIT_FILE -> editFile((ToolInvocation.EditFile) invocation, session);
        case COPY_FILE -> copyFile((ToolInvocation.CopyFile) invocation, session);
        case DELETE_FILE -> deleteFile((ToolInvocation.DeleteFile) invocation, session);
        case LIST_DIRECTORY -> listDirectory((ToolInvocation.ListDirectory) invocation, session);
        case WEB_SEARCH -> webSearch((ToolInvocation.WebSearch) invocation, session);
        case UPDATE_PLAN_STEP -> updatePlanStep((ToolInvocation.UpdatePlanStep) invocation, session);
        case ASK_USER -> askUser((ToolInvocation.AskUser) invocation, session);
        case FINISH -> finish((ToolInvocation.Finish) invocation, session);
        };
    }

    // ==================== Commands ====================

    private ToolResult executeCommand(ToolInvocation.ExecuteCommand invocation, AgentSession session) {
        ExecutionTarget target = session.getTarget();
        Duration timeout = resolveTimeout(invocation.timeoutSeconds(), target);
        log.info("[Dispatcher] Executing on {}: {}", target.describe(), invocation.command());
        CommandResult result = executionBackend.run(invocation.command(), timeout, target);

        String output = formatCommandOutput(result);
        session.recordCommand(new CommandRecord(invocation.command(), result.exitCode(), result.timedOut(),
                truncate(output, OUTPUT_SAMPLE_LENGTH), activeStepId(session), clock.instant()));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("exitCode", result.exitCode());
        data.put("duration", result.duration().toMillis());
        data.put("command", invocation.command());

        if (result.timedOut()) {
            return ToolResult.failure(ToolName.EXECUTE_COMMAND, ToolFailureKind.TIMEOUT,
                    "Command timed out after " + timeout.toSeconds() + "s and was terminated.\n" + output, data);
        }
        if (result.exitCode() != 0) {
            return ToolResult.failure(ToolName.EXECUTE_COMMAND, ToolFailureKind.EXECUTION_FAILED,
                    "Command exited with code " + result.exitCode() + ".\n" + output, data);
        }
        return ToolResult.success(ToolName.EXECUTE_COMMAND, "Exit code 0.\n" + output, data);
    }

    private Duration resolveTimeout(Integer requestedSeconds, ExecutionTarget target) {
        int seconds = target.isRemote()
                ? executionProperties.getRemoteTimeoutSeconds()
                : executionProperties.getLocalTimeoutSeconds();
        if (requestedSeconds != null && requestedSeconds > 0) {
            seconds = Math.min(requestedSeconds, executionProperties.getMaxTimeoutSeconds());
        }
        return Duration.ofSeconds(seconds);
    }

    private static String formatCommandOutput(CommandResult result) {
        StringBuilder sb = new StringBuilder();
        if (result.stdout() != null && !result.stdout().isBlank()) {
            sb.append("stdout:\n").append(result.stdout().stripTrailing()).append('\n');
        }
        if (result.stderr() != null && !result.stderr().isBlank()) {
            sb.append("stderr:\n").append(result.stderr().stripTrailing()).append('\n');
        }
        if (sb.length() == 0) {
            sb.append("(no output)");
        }
        return sb.toString();
    }

    // ==================== Files ====================

    private ToolResult readFile(ToolInvocation.ReadFile invocation, AgentSession session) {
        return fileOperation(ToolName.READ_FILE, invocation.path(), session,
                () -> fileOperator.read(session.getTarget(), invocation.path(), invocation.startLine(),
                        invocation.endLine()));
    }

    private ToolResult writeFile(ToolInvocation.WriteFile invocation, AgentSession session) {
        return fileOperation(ToolName.WRITE_FILE, invocation.path(), session,
                () -> fileOperator.write(session.getTarget(), invocation.path(), invocation.content()));
    }

    private ToolResult editFile(ToolInvocation.EditFile invocation, AgentSession session) {
        return fileOperation(ToolName.EDIT_FILE, invocation.path(), session,
                () -> fileOperator.edit(session.getTarget(), invocation.path(), invocation.action(),
                        invocation.search(), invocation.replace(), invocation.line()));
    }

    private ToolResult copyFile(ToolInvocation.CopyFile invocation, AgentSession session) {
        return fileOperation(ToolName.COPY_FILE, invocation.source() + " -> " + invocation.destination(), session,
                () -> fileOperator.copy(session.getTarget(), invocation.source(), invocation.destination(),
                        invocation.overwrite()));
    }

    private ToolResult deleteFile(ToolInvocation.DeleteFile invocation, AgentSession session) {
        return fileOperation(ToolName.DELETE_FILE, invocation.path(), session,
                () -> fileOperator.delete(session.getTarget(), invocation.path(), invocation.backup()));
    }

    private ToolResult listDirectory(ToolInvocation.ListDirectory invocation, AgentSession session) {
        try {
            return ToolResult.success(ToolName.LIST_DIRECTORY, fileOperator.list(session.getTarget(),
                    invocation.path(), invocation.recursive(), invocation.pattern()));
        } catch (FileOperationException e) {
            return ToolResult.failure(ToolName.LIST_DIRECTORY, ToolFailureKind.EXECUTION_FAILED, e.getMessage());
        }
    }

    private ToolResult fileOperation(ToolName toolName, String path, AgentSession session,
            Supplier<String> operation) {
        try {
            String output = operation.get();
            session.recordFileOperation(new FileOperationRecord(toolName, path, true,
                    toolName == ToolName.READ_FILE ? null : output, clock.instant()));
            return ToolResult.success(toolName, output);
        } catch (FileOperationException e) {
            log.warn("[Dispatcher] {} failed on {}: {}", toolName.wireName(), path, e.getMessage());
            session.recordFileOperation(new FileOperationRecord(toolName, path, false, e.getMessage(),
                    clock.instant()));
            return ToolResult.failure(toolName, ToolFailureKind.EXECUTION_FAILED, e.getMessage());
        }
    }

    // ==================== Search ====================

    private ToolResult webSearch(ToolInvocation.WebSearch invocation, AgentSession session) {
        SearchReport report = webSearchAgent.search(invocation.query(), invocation.maxSources());
        session.recordSearch(report);
        if (!report.success()) {
            return ToolResult.failure(ToolName.WEB_SEARCH, ToolFailureKind.EXECUTION_FAILED, report.summary());
        }
        StringBuilder sb = new StringBuilder(report.summary());
        report.sources().stream().limit(MAX_RESULT_SOURCES).forEach(source -> sb.append("\n--- ")
                .append(source.title()).append(" <").append(source.url()).append(">\n")
                .append(truncate(source.content(), SOURCE_EXCERPT_LENGTH)));
        if (!report.followUpSuggestions().isEmpty()) {
            sb.append("\nPossible follow-up searches: ").append(String.join("; ", report.followUpSuggestions()));
        }
        return ToolResult.success(ToolName.WEB_SEARCH, sb.toString(), report);
    }

    // ==================== Plan, user, finish ====================

    private ToolResult updatePlanStep(ToolInvocation.UpdatePlanStep invocation, AgentSession session) {
        Plan plan = session.getPlan();
        if (plan == null) {
            return ToolResult.failure(ToolName.UPDATE_PLAN_STEP, ToolFailureKind.INVALID_ARGUMENT,
                    "There is no active plan");
        }
        try {
            planService.updateStep(plan, invocation.stepId(), invocation.status(), invocation.result());
        } catch (UnknownStepException | InvalidTransitionException e) {
            return ToolResult.failure(ToolName.UPDATE_PLAN_STEP, ToolFailureKind.INVALID_ARGUMENT, e.getMessage());
        }
        return ToolResult.success(ToolName.UPDATE_PLAN_STEP, "Step " + invocation.stepId() + " is "
                + invocation.status().wireName() + ". Progress: " + planService.progressSummary(plan).describe());
    }

    private ToolResult askUser(ToolInvocation.AskUser invocation, AgentSession session) {
        if (session.isAutonomous()) {
            return ToolResult.failure(ToolName.ASK_USER, ToolFailureKind.UNAVAILABLE,
                    "ask_user is unavailable in autonomous mode. Proceed without asking, using your best judgement.");
        }
        String answer = userInteraction.ask(invocation.question());
        return ToolResult.success(ToolName.ASK_USER, "User answered: " + answer);
    }

    private ToolResult finish(ToolInvocation.Finish invocation, AgentSession session) {
        Plan plan = session.getPlan();
        if (plan != null) {
            try {
                planService.assertComplete(plan);
            } catch (IncompletePlanException e) {
                log.info("[Dispatcher] Finish rejected, {} step(s) unresolved", e.getUnresolvedSteps().size());
                return ToolResult.failure(ToolName.FINISH, ToolFailureKind.INCOMPLETE_PLAN, e.getMessage());
            }
        }
        session.setFinishSummary(invocation.summary());
        return ToolResult.success(ToolName.FINISH, invocation.summary());
    }

    private static Integer activeStepId(AgentSession session) {
        Plan plan = session.getPlan();
        return plan == null ? null : plan.getActiveStep().map(PlanStep::getId).orElse(null);
    }

    private static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }
}
