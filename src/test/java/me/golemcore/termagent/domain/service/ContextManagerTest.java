package me.golemcore.termagent.domain.service;

import me.golemcore.termagent.domain.exception.LanguageModelException;
import me.golemcore.termagent.domain.model.ConversationContext;
import me.golemcore.termagent.domain.model.Message;
import me.golemcore.termagent.domain.model.ToolName;
import me.golemcore.termagent.domain.model.ToolResult;
import me.golemcore.termagent.infrastructure.config.AgentProperties;
import me.golemcore.termagent.port.outbound.LanguageModelPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ContextManagerTest {

    private static final Instant FIXED_INSTANT = Instant.parse("2026-03-01T08:00:00Z");
    private static final String GOAL = "GOAL: free disk space on the build host";

    private LanguageModelPort languageModel;
    private AgentProperties properties;
    private ContextManager manager;
    private ConversationContext context;

    @BeforeEach
    void setUp() {
        languageModel = mock(LanguageModelPort.class);
        properties = new AgentProperties();
        properties.getContext().setWindowSize(4);
        properties.getContext().setMinMessagesBeforeSummary(2);
        manager = new ContextManager(languageModel, properties, Clock.fixed(FIXED_INSTANT, ZoneOffset.UTC));
        context = new ConversationContext();
        manager.initialize(context, "You are a terminal agent.", GOAL);
    }

    private void exchange(int turn) {
        manager.appendAssistant(context, "{\"tool\": \"execute_command\", \"arguments\": {\"command\": \"du -sh "
                + turn + "\"}}");
        manager.appendToolResult(context, ToolResult.success(ToolName.EXECUTE_COMMAND, "output " + turn));
    }

    @Test
    void shouldPinSystemPromptAndGoal() {
        // Assert
        List<Message> pinned = context.getPinnedMessages();
        assertEquals(2, pinned.size());
        assertTrue(pinned.get(0).isSystemMessage());
        assertEquals(GOAL, pinned.get(1).getContent());
        assertEquals(FIXED_INSTANT, pinned.get(1).getTimestamp());
    }

    @Test
    void shouldRefuseSecondInitialization() {
        assertThrows(IllegalStateException.class, () -> manager.initialize(context, "again", GOAL));
    }

    @Test
    void shouldKeepGoalAcrossRepeatedEviction() {
        // Arrange
        when(languageModel.sendAndWait(anyList())).thenReturn("- ran du on several directories");

        // Act
        for (int turn = 0; turn < 25; turn++) {
            exchange(turn);
            manager.enforceWindow(context);
        }

        // Assert
        List<Message> snapshot = manager.snapshot(context);
        assertTrue(snapshot.stream().anyMatch(message -> GOAL.equals(message.getContent())));
        assertEquals(4, context.getUnpinnedMessages().size());
        assertTrue(context.getEvictedCount() > 0);
    }

    @Test
    void shouldFoldEvictedMessagesIntoMemory() {
        // Arrange
        when(languageModel.sendAndWait(anyList())).thenReturn("- checked /var/log usage");
        for (int turn = 0; turn < 3; turn++) {
            exchange(turn);
        }

        // Act
        int evicted = manager.enforceWindow(context);

        // Assert
        assertEquals(2, evicted);
        List<Message> snapshot = manager.snapshot(context);
        assertTrue(snapshot.stream().anyMatch(message -> message.getContent().startsWith(
                ContextManager.MEMORY_HEADER) && message.getContent().contains("/var/log")));
        assertTrue(context.getPendingSummary().isEmpty());
    }

    @Test
    void shouldFallBackToHeuristicSummaryWhenModelFails() {
        // Arrange
        when(languageModel.sendAndWait(anyList())).thenThrow(new LanguageModelException("quota exceeded"));
        for (int turn = 0; turn < 3; turn++) {
            exchange(turn);
        }

        // Act
        manager.enforceWindow(context);

        // Assert
        String summary = context.getRollingSummary();
        assertNotNull(summary);
        assertTrue(summary.contains("- assistant:"));
    }

    @Test
    void shouldSkipModelWhenModelSummaryDisabled() {
        // Arrange
        properties.getContext().setModelSummaryEnabled(false);
        for (int turn = 0; turn < 3; turn++) {
            exchange(turn);
        }

        // Act
        manager.enforceWindow(context);

        // Assert
        verify(languageModel, never()).sendAndWait(anyList());
        assertTrue(context.getRollingSummary().contains("- tool:"));
    }

    @Test
    void shouldEvictToRespectTokenBudget() {
        // Arrange
        properties.getContext().setWindowSize(100);
        properties.getContext().setMaxEstimatedTokens(200);
        properties.getContext().setModelSummaryEnabled(false);
        for (int i = 0; i < 5; i++) {
            manager.appendUser(context, "x".repeat(400));
        }

        // Act
        manager.enforceWindow(context);

        // Assert
        assertTrue(manager.estimateTokens(manager.snapshot(context)) <= 200
                || context.getUnpinnedMessages().size() == 1);
        assertTrue(context.getPinnedMessages().stream().anyMatch(message -> GOAL.equals(message.getContent())));
    }

    @Test
    void shouldPlacePlanSnapshotAfterPinnedMessages() {
        // Arrange
        exchange(1);
        manager.updatePlanSnapshot(context, "[Action plan]\n[ ] 1. Check disk");

        // Act
        List<Message> snapshot = manager.snapshot(context);

        // Assert
        assertEquals("[Action plan]\n[ ] 1. Check disk", snapshot.get(2).getContent());
        assertTrue(snapshot.get(3).isAssistantMessage());
    }

    @Test
    void shouldKeepChronologicalOrderAfterFollowUpGoal() {
        // Arrange
        exchange(1);
        manager.addGoal(context, "GOAL: rotate the logs");
        manager.updatePlanSnapshot(context, "[Action plan]\n[ ] 1. Rotate logs");
        manager.appendAssistant(context, "{\"tool\": \"finish\", \"arguments\": {}}");

        // Act
        List<String> contents = manager.snapshot(context).stream().map(Message::getContent).toList();

        // Assert
        assertEquals(7, contents.size());
        assertEquals(GOAL, contents.get(1));
        assertTrue(contents.get(2).contains("du -sh 1"));
        assertTrue(contents.get(3).contains("output 1"));
        assertEquals("GOAL: rotate the logs", contents.get(4));
        assertEquals("[Action plan]\n[ ] 1. Rotate logs", contents.get(5));
        assertTrue(contents.get(6).contains("finish"));
    }

    @Test
    void shouldPlaceMemoryOfEvictedHistoryBeforeFollowUpGoal() {
        // Arrange
        properties.getContext().setWindowSize(1);
        properties.getContext().setModelSummaryEnabled(false);
        exchange(1);
        manager.addGoal(context, "GOAL: rotate the logs");
        manager.appendAssistant(context, "{\"tool\": \"finish\", \"arguments\": {}}");
        manager.enforceWindow(context);

        // Act
        List<String> contents = manager.snapshot(context).stream().map(Message::getContent).toList();

        // Assert
        assertEquals(GOAL, contents.get(1));
        assertTrue(contents.get(2).startsWith(ContextManager.MEMORY_HEADER));
        assertEquals("GOAL: rotate the logs", contents.get(3));
        assertTrue(contents.get(4).contains("finish"));
    }

    @Test
    void shouldSummarizeHeuristicallyWithOneBulletPerMessage() {
        // Act
        String summary = manager.summarizeHeuristically(List.of(Message.assistant("first line\nsecond line"),
                Message.tool("execute_command", "[execute_command succeeded]\nok")));

        // Assert
        assertEquals("- assistant: first line\n- tool: [execute_command succeeded]", summary);
    }
}
