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
import me.golemcore.termagent.domain.exception.UserInterruptException;
import me.golemcore.termagent.domain.model.Message;
import me.golemcore.termagent.domain.model.PromptCreation;
import me.golemcore.termagent.infrastructure.config.AgentProperties;
import me.golemcore.termagent.port.outbound.LanguageModelPort;
import me.golemcore.termagent.port.outbound.UserInteractionPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Builds a detailed prompt together with the user. The model keeps a running
 * draft and asks one clarifying question per round until it considers the
 * draft complete; the user can then extend it, run it as the agent's goal or
 * leave with the text.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PromptCreatorAgent {

    private static final String ENGINEER_PROMPT = """
            You are an expert prompt engineer.
            Help the user create a precise, actionable and detailed prompt %s.
            Ask for clarifications, missing details and context one question at a time.
            After each answer, merge everything said so far into a single coherent prompt draft.
            Ask about expected results, constraints, examples, use-case context, technologies, environment,
            level of detail and the language of the answer. If the user is vague, ask for specifics.
            Reply with JSON only:
            {"prompt_draft": "<current full prompt draft>", "question": "<next clarifying question, or null when the prompt is ready>"}
            """;
    private static final String FOR_AGENT = "for an AI agent that executes tasks in a terminal";
    private static final String FOR_ANY_PURPOSE = "for any purpose";

    private final LanguageModelPort languageModel;
    private final UserInteractionPort userInteraction;
    private final LenientJsonParser jsonParser;
    private final AgentProperties properties;

    /**
     * Runs the interactive creation.
     *
     * @param idea
     *            initial description, read from the user when blank
     * @param forAgent
     *            whether the prompt will drive this agent; only then can it be
     *            run directly
     * @return the result, empty when the user gave up, was interrupted or the
     *         model could not produce a draft
     */
    public Optional<PromptCreation> create(String idea, boolean forAgent) {
        try {
            return converse(idea, forAgent);
        } catch (UserInterruptException e) {
            log.info("[PromptCreator] Interrupted: {}", e.getMessage());
            userInteraction.notify("\nPrompt creation interrupted.");
            return Optional.empty();
        }
    }

    private Optional<PromptCreation> converse(String idea, boolean forAgent) {
        String goal = idea;
        if (goal == null || goal.isBlank()) {
            userInteraction.notify("Describe your idea:");
            goal = userInteraction.readInput("> ");
        }
        if (goal.isBlank()) {
            userInteraction.notify("Empty input.");
            return Optional.empty();
        }

        String systemPrompt = String.format(ENGINEER_PROMPT, forAgent ? FOR_AGENT : FOR_ANY_PURPOSE);
        List<String> history = new ArrayList<>();
        history.add("User: " + goal);
        StringBuilder current = new StringBuilder(goal);
        int maxIterations = properties.getPromptCreator().getMaxIterations();

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            Optional<Draft> draft = requestDraft(systemPrompt, current.toString(), history);
            if (draft.isEmpty()) {
                return Optional.empty();
            }
            if (draft.get().text() != null) {
                userInteraction.notify("\nDraft:\n" + draft.get().text());
            }
            if (draft.get().question() == null) {
                userInteraction.notify("\nPrompt is ready.");
                String prompt = draft.get().text() != null ? draft.get().text() : current.toString();
                log.info("[PromptCreator] Prompt ready after {} round(s)", iteration);
                return Optional.of(finalAction(prompt, forAgent));
            }
            userInteraction.notify("\nassistant> " + draft.get().question());
            String answer = userInteraction.readInput("> ");
            history.add("Assistant: " + draft.get().question());
            history.add("User: " + answer);
            current.append('\n').append(answer);
        }
        log.warn("[PromptCreator] No ready prompt after {} round(s)", maxIterations);
        userInteraction.notify("Stopped after " + maxIterations + " rounds without a ready prompt.");
        return Optional.empty();
    }

    record Draft(String text, String question) {
    }

    private Optional<Draft> requestDraft(String systemPrompt, String current, List<String> history) {
        String userPrompt = current + "\n\nConversation history:\n" + formatHistory(history);
        String raw;
        try {
            raw = languageModel.sendAndWait(List.of(Message.system(systemPrompt), Message.user(userPrompt)));
        } catch (LanguageModelException e) {
            log.warn("[PromptCreator] Model call failed: {}", e.getMessage());
            userInteraction.notify("The model did not answer: " + e.getMessage());
            return Optional.empty();
        }
        Optional<Draft> draft = parseDraft(raw);
        if (draft.isEmpty()) {
            log.warn("[PromptCreator] Unusable model reply: {}", raw);
            userInteraction.notify("The model reply was not a usable draft.");
        }
        return draft;
    }

    Optional<Draft> parseDraft(String raw) {
        Optional<JsonNode> parsed = jsonParser.parse(raw);
        if (parsed.isEmpty() || !parsed.get().isObject()) {
            return Optional.empty();
        }
        JsonNode node = parsed.get();
        String text = textOrNull(node, "prompt_draft");
        String question = textOrNull(node, "question");
        if (question != null && "null".equalsIgnoreCase(question)) {
            question = null;
        }
        if (text == null && question == null) {
            return Optional.empty();
        }
        return Optional.of(new Draft(text, question));
    }

    static String formatHistory(List<String> history) {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < history.size(); i++) {
            lines.add((i + 1) + ". " + history.get(i));
        }
        return String.join("\n", lines);
    }

    private PromptCreation finalAction(String prompt, boolean forAgent) {
        String finalPrompt = prompt;
        String choices = forAgent ? "[r] Run  [e] Edit  [x] Exit: " : "[e] Edit  [x] Exit: ";
        while (true) {
            String choice = userInteraction.readInput(choices).toLowerCase(Locale.ROOT);
            if ("r".equals(choice) && forAgent) {
                return new PromptCreation(finalPrompt, true);
            }
            if ("x".equals(choice)) {
                return new PromptCreation(finalPrompt, false);
            }
            if ("e".equals(choice)) {
                userInteraction.notify("\nCurrent prompt:\n" + finalPrompt);
                String addition = userInteraction.readInput("Add or modify: ");
                if (!addition.isBlank()) {
                    finalPrompt = finalPrompt + "\n" + addition;
                    userInteraction.notify("\nUpdated:\n" + finalPrompt);
                }
                continue;
            }
            userInteraction.notify(forAgent ? "Use 'r', 'e' or 'x'." : "Use 'e' or 'x'.");
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        if (!node.hasNonNull(field)) {
            return null;
        }
        String value = node.get(field).asText().trim();
        return value.isEmpty() ? null : value;
    }
}
