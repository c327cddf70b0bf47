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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.termagent.domain.exception.LanguageModelException;
import me.golemcore.termagent.domain.exception.UserInterruptException;
import me.golemcore.termagent.domain.model.Message;
import me.golemcore.termagent.infrastructure.config.AgentProperties;
import me.golemcore.termagent.port.outbound.LanguageModelPort;
import me.golemcore.termagent.port.outbound.UserInteractionPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Free-form question and answer mode. Nothing is executed: the model only
 * answers, with shell commands given as code blocks. The last
 * {@code agent.chat.history-messages} exchanges are sent with every question.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatAgent {

    static final String ASSISTANT_PROMPT = """
            You are a helpful terminal assistant.
            Answer the user's questions clearly and concisely.
            When the question is about Linux or terminal commands, give the commands as a code block.
            You cannot run anything yourself; the user runs the commands.
            """;
    static final String INPUT_LABEL = "you> ";

    private static final Set<String> EXIT_WORDS = Set.of("exit", "quit");

    private final LanguageModelPort languageModel;
    private final UserInteractionPort userInteraction;
    private final AgentProperties properties;

    /**
     * Runs the conversation until the user types {@code exit} or
     * {@code quit}, closes the input or interrupts.
     *
     * @return the number of questions the model answered
     */
    public int run() {
        userInteraction.notify("Chat mode. Ask your questions (type 'exit' to quit).");
        List<Message> history = new ArrayList<>();
        int answered = 0;
        try {
            while (true) {
                String input = userInteraction.readInput(INPUT_LABEL);
                if (input.isBlank()) {
                    continue;
                }
                if (EXIT_WORDS.contains(input.toLowerCase(Locale.ROOT))) {
                    userInteraction.notify("Leaving chat mode.");
                    break;
                }
                history.add(Message.user(input));
                String reply = answer(history);
                if (reply == null) {
                    history.remove(history.size() - 1);
                    continue;
                }
                history.add(Message.assistant(reply));
                userInteraction.notify("assistant> " + reply);
                answered++;
            }
        } catch (UserInterruptException e) {
            log.info("[Chat] Conversation ended by the user: {}", e.getMessage());
            userInteraction.notify("\nChat ended.");
        }
        log.info("[Chat] {} question(s) answered", answered);
        return answered;
    }

    private String answer(List<Message> history) {
        try {
            String reply = languageModel.sendAndWait(snapshot(history));
            if (reply == null || reply.isBlank()) {
                userInteraction.notify("No reply from the model.");
                return null;
            }
            return reply.trim();
        } catch (LanguageModelException e) {
            log.warn("[Chat] Model call failed: {}", e.getMessage());
            userInteraction.notify("The model did not answer: " + e.getMessage());
            return null;
        }
    }

    List<Message> snapshot(List<Message> history) {
        int limit = Math.max(1, properties.getChat().getHistoryMessages());
        int from = Math.max(0, history.size() - limit);
        // the window must open with a question
        while (from < history.size() - 1 && !history.get(from).isUserMessage()) {
            from++;
        }
        List<Message> snapshot = new ArrayList<>();
        snapshot.add(Message.system(ASSISTANT_PROMPT));
        snapshot.addAll(history.subList(from, history.size()));
        return snapshot;
    }
}
