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
import me.golemcore.termagent.domain.exception.LanguageModelException;
import me.golemcore.termagent.domain.model.ConversationContext;
import me.golemcore.termagent.domain.model.Message;
import me.golemcore.termagent.domain.model.ToolResult;
import me.golemcore.termagent.infrastructure.config.AgentProperties;
import me.golemcore.termagent.port.outbound.LanguageModelPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Owns the conversation log of a session and the sliding window sent to the
 * model.
 *
 * <p>
 * Before each model call the oldest non-pinned messages are evicted until both
 * the message bound and the estimated token bound hold. Evicted messages are
 * folded into a rolling summary once enough of them accumulate. The system
 * prompt, the goals and the plan snapshot are pinned and never evicted.
 */
@Service
@Slf4j
public class ContextManager {

    static final String MEMORY_HEADER = "[Conversation memory]\n";
    private static final int CHARS_PER_TOKEN = 4;
    private static final int MAX_HEURISTIC_BULLETS = 20;
    private static final int BULLET_LENGTH = 160;
    private static final int SUMMARY_INPUT_MESSAGE_LENGTH = 1500;

    private final LanguageModelPort languageModel;
    private final AgentProperties.ContextProperties properties;
    private final Clock clock;

    public ContextManager(LanguageModelPort languageModel, AgentProperties properties, Clock clock) {
        this.languageModel = languageModel;
        this.properties = properties.getContext();
        this.clock = clock;
    }

    // ==================== Appending ====================

    public void initialize(ConversationContext context, String systemPrompt, String goalMessage) {
        if (!context.getMessages().isEmpty()) {
            throw new IllegalStateException("Context already initialized");
        }
        context.append(pinned(Message.ROLE_SYSTEM, systemPrompt));
        context.append(pinned(Message.ROLE_USER, goalMessage));
    }

    /**
     * Pins a follow-up goal; earlier goals stay pinned.
     */
    public void addGoal(ConversationContext context, String goalMessage) {
        context.append(pinned(Message.ROLE_USER, goalMessage));
    }

    public void updatePlanSnapshot(ConversationContext context, String renderedPlan) {
        context.setPlanSnapshot(pinned(Message.ROLE_SYSTEM, renderedPlan));
    }

    public void appendAssistant(ConversationContext context, String content) {
        context.append(stamp(Message.assistant(content)));
    }

    public void appendUser(ConversationContext context, String content) {
        context.append(stamp(Message.user(content)));
    }

    public void appendToolResult(ConversationContext context, ToolResult result) {
        String toolName = result.getToolName() != null ? result.getToolName().wireName() : null;
        context.append(stamp(Message.tool(toolName, result.toMessageContent())));
    }

    // ==================== Window ====================

    /**
     * Evicts old messages until the window bounds hold. The newest message is
     * always kept.
     *
     * @return number of messages evicted
     */
    public int enforceWindow(ConversationContext context) {
        int evicted = 0;
        while (exceedsBounds(context) && context.getUnpinnedMessages().size() > 1) {
            if (context.evictOldestUnpinned().isEmpty()) {
                break;
            }
            evicted++;
        }
        if (evicted > 0) {
            log.debug("[Context] Evicted {} message(s), {} remain", evicted, context.size());
        }
        if (context.getPendingSummary().size() >= properties.getMinMessagesBeforeSummary()) {
            summarizePending(context);
        }
        return evicted;
    }

    private boolean exceedsBounds(ConversationContext context) {
        return context.getUnpinnedMessages().size() > properties.getWindowSize()
                || estimateTokens(snapshot(context)) > properties.getMaxEstimatedTokens();
    }

    /**
     * Messages sent to the model, in log order. Pinned messages keep their
     * position, the plan snapshot follows the latest goal and the rolling
     * summary of evicted history follows the first goal.
     */
    public List<Message> snapshot(ConversationContext context) {
        List<Message> messages = context.getMessages();
        int firstGoal = -1;
        int latestGoal = -1;
        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);
            if (message.isPinned() && !message.isSystemMessage()) {
                firstGoal = firstGoal < 0 ? i : firstGoal;
                latestGoal = i;
            }
        }

        List<Message> snapshot = new ArrayList<>(messages.size() + 2);
        for (int i = 0; i < messages.size(); i++) {
            snapshot.add(messages.get(i));
            if (i == latestGoal && context.getPlanSnapshot() != null) {
                snapshot.add(context.getPlanSnapshot());
            }
            if (i == firstGoal) {
                addMemory(snapshot, context);
            }
        }
        if (firstGoal < 0) {
            if (context.getPlanSnapshot() != null) {
                snapshot.add(context.getPlanSnapshot());
            }
            addMemory(snapshot, context);
        }
        return snapshot;
    }

    private static void addMemory(List<Message> snapshot, ConversationContext context) {
        String summary = context.getRollingSummary();
        if (summary != null && !summary.isBlank()) {
            snapshot.add(Message.system(MEMORY_HEADER + summary));
        }
    }

    public int estimateTokens(List<Message> messages) {
        int chars = 0;
        for (Message message : messages) {
            chars += message.getContent() != null ? message.getContent().length() : 0;
        }
        return chars / CHARS_PER_TOKEN;
    }

    // ==================== Rolling summary ====================

    private void summarizePending(ConversationContext context) {
        List<Message> pending = List.copyOf(context.getPendingSummary());
        String addition = properties.isModelSummaryEnabled() ? summarizeWithModel(pending) : null;
        if (addition == null || addition.isBlank()) {
            addition = summarizeHeuristically(pending);
        }
        String previous = context.getRollingSummary();
        String merged = previous == null || previous.isBlank() ? addition : previous + "\n" + addition;
        int limit = properties.getSummaryCharLimit();
        if (merged.length() > limit) {
            merged = merged.substring(merged.length() - limit);
        }
        context.setRollingSummary(merged);
        context.clearPendingSummary();
        log.info("[Context] Folded {} evicted message(s) into conversation memory ({} chars)", pending.size(),
                merged.length());
    }

    private String summarizeWithModel(List<Message> messages) {
        StringBuilder transcript = new StringBuilder();
        for (Message message : messages) {
            String content = message.getContent() == null ? "" : message.getContent();
            if (content.length() > SUMMARY_INPUT_MESSAGE_LENGTH) {
                content = content.substring(0, SUMMARY_INPUT_MESSAGE_LENGTH) + "...";
            }
            transcript.append('[').append(message.getRole()).append("] ").append(content).append('\n');
        }
        List<Message> request = List.of(
                Message.system("Summarize the following agent conversation excerpt in at most 10 short bullet "
                        + "points. Keep commands run, their outcomes, file paths and decisions. Plain text only."),
                Message.user(transcript.toString()));
        try {
            String summary = languageModel.sendAndWait(request);
            return summary == null ? null : summary.strip();
        } catch (LanguageModelException e) {
            log.warn("[Context] Model summary failed, using heuristic summary: {}", e.getMessage());
            return null;
        }
    }

    String summarizeHeuristically(List<Message> messages) {
        StringBuilder sb = new StringBuilder();
        int bullets = 0;
        for (Message message : messages) {
            if (bullets >= MAX_HEURISTIC_BULLETS) {
                break;
            }
            String content = message.getContent() == null ? "" : message.getContent().strip();
            String firstLine = content.lines().findFirst().orElse("");
            if (firstLine.isBlank()) {
                continue;
            }
            if (firstLine.length() > BULLET_LENGTH) {
                firstLine = firstLine.substring(0, BULLET_LENGTH) + "...";
            }
            sb.append("- ").append(message.getRole()).append(": ").append(firstLine).append('\n');
            bullets++;
        }
        return sb.toString().stripTrailing();
    }

    private Message pinned(String role, String content) {
        return Message.builder().role(role).content(content).pinned(true).timestamp(clock.instant()).build();
    }

    private Message stamp(Message message) {
        message.setTimestamp(clock.instant());
        return message;
    }
}
