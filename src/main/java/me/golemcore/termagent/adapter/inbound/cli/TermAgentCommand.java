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

package me.golemcore.termagent.adapter.inbound.cli;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.termagent.domain.exception.ExecutionBackendException;
import me.golemcore.termagent.domain.exception.UserInterruptException;
import me.golemcore.termagent.domain.loop.AgentOrchestrator;
import me.golemcore.termagent.domain.model.ExecutionMode;
import me.golemcore.termagent.domain.model.PromptCreation;
import me.golemcore.termagent.domain.model.RemoteHost;
import me.golemcore.termagent.domain.model.SessionOptions;
import me.golemcore.termagent.domain.model.SessionReport;
import me.golemcore.termagent.domain.service.ChatAgent;
import me.golemcore.termagent.domain.service.PromptCreatorAgent;
import me.golemcore.termagent.infrastructure.config.AgentProperties;
import me.golemcore.termagent.port.outbound.LanguageModelPort;
import me.golemcore.termagent.port.outbound.UserInteractionPort;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command-line entry: parses flags, applies them over the configured defaults
 * and runs one interactive session. {@code --chat} switches to a question and
 * answer conversation that runs nothing; {@code --create-prompt} builds the
 * goal interactively before the session starts.
 *
 * <p>
 * Ctrl+C is handled by a shutdown hook that cancels the running session and
 * holds the JVM until the aborted goal's report is written and the remote
 * connection is closed.
 */
@Component
@Slf4j
@CommandLine.Command(
        name = "term-agent",
        mixinStandardHelpOptions = true,
        description = "Plans and executes a task in the terminal with a language model.")
public class TermAgentCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_ABORTED = 1;
    static final int EXIT_USAGE = 2;
    static final String BASE_PACKAGE = "me.golemcore.termagent";
    static final long INTERRUPT_GRACE_SECONDS = 15;

    private final AgentOrchestrator orchestrator;
    private final AgentProperties properties;
    private final LanguageModelPort languageModel;
    private final UserInteractionPort userInteraction;
    private final ChatAgent chatAgent;
    private final PromptCreatorAgent promptCreator;

    @CommandLine.Parameters(arity = "0..*", paramLabel = "GOAL", description = "The task to perform.")
    private List<String> goalWords = List.of();

    @CommandLine.Option(names = { "-r", "--remote" }, paramLabel = "USER@HOST[:PORT]",
            description = "Run commands and file operations on a remote host over SSH.")
    private String remote;

    @CommandLine.Option(names = "--step-limit", description = "Maximum model turns per goal.")
    private Integer stepLimit;

    @CommandLine.Option(names = "--timeout", description = "Default local command timeout in seconds.")
    private Integer timeout;

    @CommandLine.Option(names = "--remote-timeout", description = "Default remote command timeout in seconds.")
    private Integer remoteTimeout;

    @CommandLine.Option(names = { "-a", "--autonomous" },
            description = "Execute without per-action confirmation. Dangerous commands are still confirmed.")
    private boolean autonomous;

    @CommandLine.Option(names = "--provider", description = "LLM provider: openai, anthropic, gemini, ollama, openrouter.")
    private String provider;

    @CommandLine.Option(names = { "-m", "--model" }, description = "Model name.")
    private String model;

    @CommandLine.Option(names = "--temperature", description = "Sampling temperature.")
    private Double temperature;

    @CommandLine.Option(names = "--no-plan-review", description = "Accept the generated plan without review.")
    private boolean noPlanReview;

    @CommandLine.Option(names = { "-c", "--chat" },
            description = "Ask questions in a free-form conversation. Nothing is executed.")
    private boolean chat;

    @CommandLine.Option(names = { "-p", "--create-prompt" },
            description = "Build a detailed prompt with the model's help, then optionally run it as the goal.")
    private boolean createPrompt;

    @CommandLine.Option(names = "--log-level", description = "Log level for the agent: TRACE, DEBUG, INFO, WARN, ERROR.")
    private String logLevel;

    public TermAgentCommand(AgentOrchestrator orchestrator, AgentProperties properties,
            LanguageModelPort languageModel, UserInteractionPort userInteraction, ChatAgent chatAgent,
            PromptCreatorAgent promptCreator) {
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.languageModel = languageModel;
        this.userInteraction = userInteraction;
        this.chatAgent = chatAgent;
        this.promptCreator = promptCreator;
    }

    @Override
    public Integer call() {
        SessionOptions options;
        try {
            applyOverrides();
            options = buildOptions();
            checkModes();
        } catch (IllegalArgumentException e) {
            userInteraction.notify(e.getMessage());
            return EXIT_USAGE;
        }
        if (!languageModel.isAvailable()) {
            userInteraction.notify("No API key configured for provider '" + languageModel.getProviderId()
                    + "'. Set agent.llm.api-key (or TERM_AGENT_API_KEY).");
            return EXIT_USAGE;
        }

        if (chat) {
            chatAgent.run();
            return EXIT_OK;
        }

        String goal = String.join(" ", goalWords).trim();
        if (createPrompt) {
            Optional<PromptCreation> creation = runPromptCreator(goal);
            if (creation.isEmpty()) {
                return EXIT_ABORTED;
            }
            if (!creation.get().execute()) {
                userInteraction.notify("\nFinal prompt:\n" + creation.get().prompt());
                return EXIT_OK;
            }
            goal = creation.get().prompt();
        }

        CountDownLatch sessionDone = new CountDownLatch(1);
        Thread interruptHandler = interruptHandler(sessionDone);
        Runtime.getRuntime().addShutdownHook(interruptHandler);
        try {
            return runSession(goal, options);
        } finally {
            sessionDone.countDown();
            removeHook(interruptHandler);
        }
    }

    private void checkModes() {
        if (chat && createPrompt) {
            throw new IllegalArgumentException("--chat and --create-prompt cannot be combined.");
        }
        if (chat && remote != null) {
            throw new IllegalArgumentException("Chat mode does not support --remote.");
        }
    }

    private Optional<PromptCreation> runPromptCreator(String idea) {
        boolean forAgent;
        try {
            forAgent = userInteraction.askYesNo("Is the prompt meant for this agent to execute?");
        } catch (UserInterruptException e) {
            log.info("[CLI] Interrupted before prompt creation started");
            return Optional.empty();
        }
        return promptCreator.create(idea, forAgent);
    }

    private int runSession(String initialGoal, SessionOptions options) {
        String goal = initialGoal;
        try {
            if (goal.isEmpty()) {
                goal = userInteraction.ask("What should I do?");
            }
            if (goal.isBlank()) {
                userInteraction.notify("No goal given.");
                return EXIT_USAGE;
            }
            List<SessionReport> reports = orchestrator.run(goal, options);
            return reports.isEmpty() || !reports.get(reports.size() - 1).isFinished() ? EXIT_ABORTED : EXIT_OK;
        } catch (UserInterruptException e) {
            log.info("[CLI] Interrupted before the session started");
            return EXIT_ABORTED;
        } catch (ExecutionBackendException e) {
            userInteraction.notify("Cannot reach the execution target: " + e.getMessage());
            return EXIT_ABORTED;
        }
    }

    Thread interruptHandler(CountDownLatch sessionDone) {
        return new Thread(() -> {
            if (!orchestrator.isRunning()) {
                return;
            }
            userInteraction.notify("\nInterrupted, stopping the session...");
            orchestrator.cancel();
            try {
                if (!sessionDone.await(INTERRUPT_GRACE_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("[CLI] Session did not stop within {}s", INTERRUPT_GRACE_SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[CLI] Interrupted while waiting for the session to stop");
            }
        }, "term-agent-interrupt");
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("[CLI] Shutdown already in progress, interrupt handler stays registered");
        }
    }

    void applyOverrides() {
        if (logLevel != null) {
            LogLevel level = LogLevel.valueOf(logLevel.trim().toUpperCase(Locale.ROOT));
            LoggingSystem.get(getClass().getClassLoader()).setLogLevel(BASE_PACKAGE, level);
        }
        AgentProperties.LlmProperties llm = properties.getLlm();
        if (provider != null) {
            llm.setProvider(provider);
        }
        if (model != null) {
            llm.setModel(model);
        }
        if (temperature != null) {
            llm.setTemperature(temperature);
        }
        AgentProperties.ExecutionProperties execution = properties.getExecution();
        if (timeout != null) {
            execution.setLocalTimeoutSeconds(requirePositive(timeout, "--timeout"));
        }
        if (remoteTimeout != null) {
            execution.setRemoteTimeoutSeconds(requirePositive(remoteTimeout, "--remote-timeout"));
        }
    }

    SessionOptions buildOptions() {
        AgentProperties.OrchestratorProperties orchestratorProperties = properties.getOrchestrator();
        ExecutionMode mode = autonomous ? ExecutionMode.AUTONOMOUS
                : ExecutionMode.fromValue(orchestratorProperties.getMode());
        int limit = stepLimit != null ? requirePositive(stepLimit, "--step-limit")
                : orchestratorProperties.getStepLimit();
        RemoteHost host = remote != null ? RemoteHost.parse(remote) : null;
        return new SessionOptions(mode, limit, host,
                orchestratorProperties.isPlanReviewEnabled() && !noPlanReview,
                orchestratorProperties.getDeepAnalysis(),
                orchestratorProperties.isContinuationEnabled());
    }

    private static int requirePositive(int value, String option) {
        if (value < 1) {
            throw new IllegalArgumentException(option + " must be positive: " + value);
        }
        return value;
    }
}
