package me.golemcore.termagent.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import me.golemcore.termagent.domain.exception.LanguageModelException;
import me.golemcore.termagent.domain.model.Message;
import me.golemcore.termagent.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class Langchain4jAdapterTest {

    private static final List<Message> SNAPSHOT = List.of(Message.system("You are an agent"),
            Message.user("GOAL: list files"));

    private AgentProperties properties;
    private ChatModel chatModel;
    private List<Long> sleeps;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        properties.getLlm().setMaxRetries(2);
        properties.getLlm().setInitialBackoffMs(100);
        chatModel = mock(ChatModel.class);
        sleeps = new ArrayList<>();
        adapter = new Langchain4jAdapter(properties, chatModel) {
            @Override
            void sleep(long backoffMs) {
                sleeps.add(backoffMs);
            }
        };
    }

    private static ChatResponse reply(String text) {
        return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
    }

    @Test
    void sendReturnsModelText() {
        when(chatModel.chat(anyList())).thenReturn(reply("{\"tool\": \"finish\"}"));

        assertEquals("{\"tool\": \"finish\"}", adapter.sendAndWait(SNAPSHOT));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void sendRetriesRateLimitWithExponentialBackoff() {
        when(chatModel.chat(anyList()))
                .thenThrow(new RuntimeException("HTTP 429 Too Many Requests"))
                .thenThrow(new RuntimeException("rate_limit_exceeded"))
                .thenReturn(reply("ok"));

        assertEquals("ok", adapter.sendAndWait(SNAPSHOT));
        assertEquals(List.of(100L, 200L), sleeps);
        verify(chatModel, times(3)).chat(anyList());
    }

    @Test
    void sendGivesUpWhenRateLimitPersists() {
        when(chatModel.chat(anyList())).thenThrow(new RuntimeException("429"));

        assertThrows(LanguageModelException.class, () -> adapter.sendAndWait(SNAPSHOT));
        verify(chatModel, times(3)).chat(anyList());
    }

    @Test
    void sendDoesNotRetryOtherErrors() {
        when(chatModel.chat(anyList())).thenThrow(new RuntimeException("401 Unauthorized"));

        LanguageModelException error = assertThrows(LanguageModelException.class,
                () -> adapter.sendAndWait(SNAPSHOT));

        assertTrue(error.getMessage().contains("401"));
        verify(chatModel, times(1)).chat(anyList());
    }

    @Test
    void sendRejectsEmptyReply() {
        when(chatModel.chat(anyList())).thenReturn(reply("  "));

        assertThrows(LanguageModelException.class, () -> adapter.sendAndWait(SNAPSHOT));
    }

    @Test
    void unsupportedProviderFailsOnFirstCall() {
        properties.getLlm().setProvider("mystery");
        Langchain4jAdapter unconfigured = new Langchain4jAdapter(properties);

        LanguageModelException error = assertThrows(LanguageModelException.class,
                () -> unconfigured.sendAndWait(SNAPSHOT));

        assertTrue(error.getMessage().contains("mystery"));
    }

    @Test
    void isAvailableRequiresKeyExceptForOllama() {
        Langchain4jAdapter plain = new Langchain4jAdapter(properties);
        properties.getLlm().setApiKey(null);
        assertFalse(plain.isAvailable());

        properties.getLlm().setApiKey("sk-test");
        assertTrue(plain.isAvailable());

        properties.getLlm().setApiKey(null);
        properties.getLlm().setProvider(" Ollama ");
        assertTrue(plain.isAvailable());
        assertEquals("ollama", plain.getProviderId());
    }

    @Test
    void isRateLimitErrorDetectsNestedCauseAndQuota() {
        assertTrue(Langchain4jAdapter.isRateLimitError(
                new RuntimeException("LLM failed", new RuntimeException("token_quota_exceeded"))));
        assertFalse(Langchain4jAdapter.isRateLimitError(new RuntimeException("Connection refused")));
        assertFalse(Langchain4jAdapter.isRateLimitError(new RuntimeException((String) null)));
    }

    @Test
    void convertMessagesMapsRolesAndPrefixesToolResults() {
        List<ChatMessage> converted = Langchain4jAdapter.convertMessages(List.of(
                Message.system("sys"),
                Message.user("goal"),
                Message.assistant("{\"tool\": \"list_directory\"}"),
                Message.tool("list_directory", "a.txt")));

        assertInstanceOf(SystemMessage.class, converted.get(0));
        assertInstanceOf(UserMessage.class, converted.get(1));
        assertInstanceOf(AiMessage.class, converted.get(2));
        UserMessage toolResult = (UserMessage) converted.get(3);
        assertEquals(Langchain4jAdapter.TOOL_RESULT_PREFIX + "a.txt", toolResult.singleText());
    }
}
