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

package me.golemcore.termagent.adapter.outbound.console;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.termagent.domain.exception.UserInterruptException;
import me.golemcore.termagent.domain.model.ConfirmationDecision;
import me.golemcore.termagent.domain.model.Plan;
import me.golemcore.termagent.domain.model.PlanReviewDecision;
import me.golemcore.termagent.domain.model.PlanStep;
import me.golemcore.termagent.domain.model.RiskTier;
import me.golemcore.termagent.domain.model.SecurityVerdict;
import me.golemcore.termagent.port.outbound.UserInteractionPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Terminal implementation of UserInteractionPort.
 *
 * <p>
 * End of input on any prompt raises {@link UserInterruptException}, and so does
 * interrupting the thread waiting at a prompt. Lines are read on a separate
 * thread; a read abandoned by an interrupt is picked up by the next prompt.
 */
@Component
@Slf4j
public class ConsoleUserInteractionAdapter implements UserInteractionPort {

    private final BufferedReader in;
    private final PrintStream out;
    private final ExecutorService reader = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "console-input");
        thread.setDaemon(true);
        return thread;
    });
    private Future<String> pendingLine;

    @Autowired
    public ConsoleUserInteractionAdapter() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    ConsoleUserInteractionAdapter(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public ConfirmationDecision confirm(String description, SecurityVerdict verdict) {
        out.println();
        if (verdict != null && verdict.tier() != RiskTier.SAFE) {
            out.println("!! " + verdict.tier() + ": " + verdict.rationale());
        }
        out.println("Proposed action:");
        out.println(indent(description));
        while (true) {
            String answer = prompt("Execute? [y]es / [n]o / [a]ll (switch to autonomous): ")
                    .toLowerCase(Locale.ROOT);
            switch (answer) {
            case "y", "yes" -> {
                return ConfirmationDecision.APPROVE;
            }
            case "n", "no" -> {
                return ConfirmationDecision.DENY;
            }
            case "a", "all" -> {
                return ConfirmationDecision.APPROVE_ALL;
            }
            default -> out.println("Please answer y, n or a.");
            }
        }
    }

    @Override
    public String requestJustification(String description) {
        String reason = prompt("Why was this refused? (optional): ");
        return reason.isBlank() ? "no reason given" : reason;
    }

    @Override
    public String ask(String question) {
        out.println();
        out.println("Agent asks: " + question);
        return prompt("> ");
    }

    @Override
    public String readInput(String label) {
        return prompt(label);
    }

    @Override
    public PlanReviewDecision reviewPlan(Plan plan) {
        out.println();
        out.println("Proposed plan (revision " + plan.getRevision() + "):");
        for (PlanStep step : plan.getSteps()) {
            out.println("  " + step.getId() + ". " + step.getDescription());
            if (step.getCommand() != null) {
                out.println("       $ " + step.getCommand());
            }
        }
        while (true) {
            String answer = prompt("Accept plan? [y]es / [n]o (abort) / [e]dit with feedback: ")
                    .toLowerCase(Locale.ROOT);
            switch (answer) {
            case "y", "yes" -> {
                return PlanReviewDecision.accept();
            }
            case "n", "no" -> {
                return PlanReviewDecision.reject();
            }
            case "e", "edit", "r", "revise" -> {
                String feedback = prompt("What should change? ");
                if (!feedback.isBlank()) {
                    return PlanReviewDecision.revise(feedback);
                }
                out.println("Feedback is required to revise the plan.");
            }
            default -> out.println("Please answer y, n or e.");
            }
        }
    }

    @Override
    public boolean askYesNo(String question) {
        while (true) {
            String answer = prompt(question + " [y/n]: ").toLowerCase(Locale.ROOT);
            if ("y".equals(answer) || "yes".equals(answer)) {
                return true;
            }
            if ("n".equals(answer) || "no".equals(answer)) {
                return false;
            }
        }
    }

    @Override
    public Optional<String> requestNextGoal() {
        out.println();
        String goal = prompt("Next goal (empty to quit): ");
        return goal.isBlank() ? Optional.empty() : Optional.of(goal);
    }

    @Override
    public void notify(String message) {
        out.println(message);
    }

    @PreDestroy
    public void shutdown() {
        reader.shutdownNow();
    }

    private String prompt(String text) {
        out.print(text);
        out.flush();
        if (pendingLine == null) {
            pendingLine = reader.submit(in::readLine);
        }
        String line;
        try {
            line = pendingLine.get();
            pendingLine = null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            out.println();
            throw new UserInterruptException("Interrupted at prompt", e);
        } catch (ExecutionException e) {
            pendingLine = null;
            log.warn("[Console] Failed to read input", e.getCause());
            throw new UserInterruptException("Failed to read input", e.getCause());
        }
        if (line == null) {
            throw new UserInterruptException("Input closed");
        }
        return line.trim();
    }

    private static String indent(String text) {
        return "  " + text.replace("\n", "\n  ");
    }
}
