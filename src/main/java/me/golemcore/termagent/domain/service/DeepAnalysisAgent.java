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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.termagent.domain.exception.LanguageModelException;
import me.golemcore.termagent.domain.model.AgentSession;
import me.golemcore.termagent.domain.model.AnalysisReport;
import me.golemcore.termagent.domain.model.CommandRecord;
import me.golemcore.termagent.domain.model.FileOperationRecord;
import me.golemcore.termagent.domain.model.Message;
import me.golemcore.termagent.domain.model.Plan;
import me.golemcore.termagent.domain.model.PlanProgress;
import me.golemcore.termagent.domain.model.PlanStep;
import me.golemcore.termagent.domain.model.SearchReport;
import me.golemcore.termagent.port.outbound.LanguageModelPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Produces a structured post-run report of a finished session. Reads the
 * session only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeepAnalysisAgent {

    private static final String SEPARATOR = "=".repeat(70);
    private static final int MAX_COMMANDS = 20;
    private static final int MAX_MESSAGES = 30;
    private static final int COMMAND_SAMPLE = 1500;
    private static final int SEARCH_SAMPLE = 1500;
    private static final int MESSAGE_SAMPLE = 1000;
    private static final int SIGNIFICANT_MESSAGE_LENGTH = 20;

    private static final String ANALYST_PROMPT = """
            You are a senior engineer reviewing the work of an automation agent.
            Judge honestly whether the user's goal was achieved, using the evidence provided.
            Reply with JSON only:
            {"goal_achievement": str, "execution_summary": str, "successes": [str], "failures": [str],
             "technical_analysis": str, "recommendations": [str],
             "verdict": "completed" | "partially-completed" | "failed"}
            """;

    private final LanguageModelPort languageModel;
    private final LenientJsonParser jsonParser;
    private final PlanService planService;

    public AnalysisReport analyze(AgentSession session) {
        String prompt = buildAnalysisPrompt(session);
        try {
            String raw = languageModel.sendAndWait(List.of(Message.system(ANALYST_PROMPT), Message.user(prompt)));
            Optional<AnalysisReport> report = parseReport(raw);
            if (report.isPresent()) {
                log.info("[Analysis] Verdict for session {}: {}", session.getId(), report.get().verdict().wireName());
                return report.get();
            }
            log.warn("[Analysis] Model reply was not a usable report, falling back to plan statistics");
        } catch (LanguageModelException e) {
            log.warn("[Analysis] Model unavailable, falling back to plan statistics: {}", e.getMessage());
        }
        return heuristicReport(session);
    }

    String buildAnalysisPrompt(AgentSession session) {
        List<String> sections = new ArrayList<>();
        sections.add(SEPARATOR);
        sections.add("DEEP ANALYSIS REQUEST");
        sections.add(SEPARATOR);
        sections.add("\n## USER'S GOAL");
        sections.add(session.getGoal());
        sections.add("\n## AGENT'S OWN SUMMARY");
        sections.add(session.getFinishSummary() != null ? session.getFinishSummary() : "No summary provided");

        Plan plan = session.getPlan();
        if (plan != null) {
            sections.add("\n## ACTION PLAN (with statuses)");
            sections.add(planService.renderForModel(plan));
            PlanProgress progress = planService.progressSummary(plan);
            sections.add("\n## PLAN PROGRESS STATISTICS");
            sections.add(String.format("Total: %d | Completed: %d | Failed: %d | Skipped: %d | Pending: %d | "
                    + "Success rate: %d%%", progress.total(), progress.completedCount(), progress.failedCount(),
                    progress.skippedCount(), progress.pendingCount(), progress.percentage()));
        }

        List<CommandRecord> commands = session.getCommands();
        if (!commands.isEmpty()) {
            sections.add("\n## COMMAND RESULTS");
            List<CommandRecord> recent = commands.subList(Math.max(0, commands.size() - MAX_COMMANDS),
                    commands.size());
            int index = 1;
            for (CommandRecord command : recent) {
                sections.add("\n--- Command " + index++ + " ---");
                sections.add(truncate("$ " + command.command() + "\nexit code: " + command.exitCode()
                        + (command.timedOut() ? " (timed out)" : "") + "\n" + command.outputSample(),
                        COMMAND_SAMPLE));
            }
        }

        if (!session.getFileOperations().isEmpty()) {
            sections.add("\n## FILE OPERATIONS");
            for (FileOperationRecord operation : session.getFileOperations()) {
                sections.add("  - " + operation.operation().wireName() + " " + operation.path() + ": "
                        + (operation.success() ? "ok" : "failed") + (operation.detail() != null
                                ? " (" + truncate(operation.detail(), 200) + ")"
                                : ""));
            }
        }

        if (!session.getSearches().isEmpty()) {
            sections.add("\n## WEB SEARCH RESULTS");
            int index = 1;
            for (SearchReport search : session.getSearches()) {
                sections.add("\n--- Web Search " + index++ + " ---");
                sections.add(truncate(search.summary(), SEARCH_SAMPLE));
            }
        }

        List<Message> significant = session.getContext().getMessages().stream()
                .filter(message -> message.isAssistantMessage() || message.isToolMessage())
                .filter(message -> message.getContent() != null
                        && message.getContent().length() > SIGNIFICANT_MESSAGE_LENGTH)
                .toList();
        if (!significant.isEmpty()) {
            sections.add("\n## CONVERSATION HISTORY (last " + MAX_MESSAGES + " significant messages)");
            for (Message message : significant.subList(Math.max(0, significant.size() - MAX_MESSAGES),
                    significant.size())) {
                sections.add("\n[" + (message.isAssistantMessage() ? "AGENT" : "RESULT") + "]");
                sections.add(truncate(message.getContent(), MESSAGE_SAMPLE));
            }
        }

        sections.add("\n" + SEPARATOR);
        sections.add("Based on all sources above, produce the report. Reference actual commands, outputs and "
                + "steps, and give actionable recommendations.");
        return String.join("\n", sections);
    }

    Optional<AnalysisReport> parseReport(String raw) {
        Optional<JsonNode> parsed = jsonParser.parse(raw);
        if (parsed.isEmpty() || !parsed.get().isObject()) {
            return Optional.empty();
        }
        JsonNode node = parsed.get();
        if (!node.hasNonNull("verdict")) {
            return Optional.empty();
        }
        AnalysisReport.Verdict verdict;
        try {
            verdict = AnalysisReport.Verdict.fromWireName(node.get("verdict").asText());
        } catch (IllegalArgumentException e) {
            log.debug("[Analysis] Unknown verdict in model reply: {}", e.getMessage());
            return Optional.empty();
        }
        return Optional.of(new AnalysisReport(
                text(node, "goal_achievement"),
                text(node, "execution_summary"),
                list(node, "successes"),
                list(node, "failures"),
                text(node, "technical_analysis"),
                list(node, "recommendations"),
                verdict));
    }

    AnalysisReport heuristicReport(AgentSession session) {
        Plan plan = session.getPlan();
        List<String> successes = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        AnalysisReport.Verdict verdict = AnalysisReport.Verdict.FAILED;
        String progressText = "No plan was accepted.";
        if (plan != null && !plan.getSteps().isEmpty()) {
            for (PlanStep step : plan.getSteps()) {
                String line = step.getId() + ". " + step.getDescription()
                        + (step.getResult() != null ? ": " + step.getResult() : "");
                if (step.getStatus() == PlanStep.StepStatus.COMPLETED) {
                    successes.add(line);
                } else {
                    failures.add(line + " [" + step.getStatus().wireName() + "]");
                }
            }
            PlanProgress progress = planService.progressSummary(plan);
            progressText = progress.describe();
            if (progress.completedCount() == progress.total()) {
                verdict = AnalysisReport.Verdict.COMPLETED;
            } else if (progress.completedCount() > 0) {
                verdict = AnalysisReport.Verdict.PARTIALLY_COMPLETED;
            }
        }
        long failedCommands = session.getCommands().stream().filter(c -> c.exitCode() != 0 || c.timedOut()).count();
        return new AnalysisReport(
                "Derived from plan statistics: " + progressText,
                session.getCommands().size() + " command(s) run (" + failedCommands + " failed), "
                        + session.getFileOperations().size() + " file operation(s), "
                        + session.getSearches().size() + " web search(es).",
                successes,
                failures,
                "Model analysis was unavailable; this report reflects recorded step statuses only.",
                failures.isEmpty() ? List.of() : List.of("Review the failed or skipped steps and rerun them."),
                verdict);
    }

    private static String text(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : "";
    }

    private static List<String> list(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            return List.of(value.asText());
        }
        List<String> items = new ArrayList<>();
        value.forEach(item -> items.add(item.asText()));
        return items;
    }

    private static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }
}
