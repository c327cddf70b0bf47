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

package me.golemcore.termagent.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.termagent.domain.exception.LanguageModelException;
import me.golemcore.termagent.domain.model.Message;
import me.golemcore.termagent.infrastructure.config.AgentProperties;
import me.golemcore.termagent.port.outbound.LanguageModelPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * LanguageModelPort backed by langchain4j chat models.
 *
 * <p>
 * Anthropic uses its native client. Every other provider speaks the
 * OpenAI-compatible API, with a default base URL per provider unless
 * {@code agent.llm.base-url} overrides it. Rate-limit errors are retried with
 * exponential backoff; anything else fails the call.
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LanguageModelPort {

    static final String PROVIDER_ANTHROPIC = "anthropic";
    static final String PROVIDER_OPENAI = "openai";
    private static final double BACKOFF_MULTIPLIER = 2.0;
    static final String TOOL_RESULT_PREFIX = "[tool result]\n";

    private static final Map<String, String> DEFAULT_BASE_URLS = Map.of(
            "gemini", "https://generativelanguage.googleapis.com/v1beta/openai/",
            "ollama", "http://localhost:11434/v1",
            "openrouter", "https://openrouter.ai/api/v1");

    private final AgentProperties.LlmProperties settings;

    private ChatModel chatModel;
    private volatile boolean initialized = false;

    public Langchain4jAdapter(AgentProperties properties) {
        this.settings = properties.getLlm();
    }

    Langchain4jAdapter(AgentProperties properties, ChatModel chatModel) {
        this.settings = properties.getLlm();
        this.chatModel = chatModel;
        this.initialized = true;
    }

    private synchronized void ensureInitialized() {
        if (initialized) {
            return;
        }
        String provider = getProviderId();
        if (!PROVIDER_ANTHROPIC.equals(provider) && !PROVIDER_OPENAI.equals(provider)
                && !DEFAULT_BASE_URLS.containsKey(provider)) {
            throw new LanguageModelException("Unsupported language model provider: " + provider);
        }
        this.chatModel = PROVIDER_ANTHROPIC.equals(provider) ? createAnthropicModel() : createOpenAiModel(provider);
        initialized = true;
        log.info("[LLM] Initialized provider {} with model {}", provider, settings.getModel());
    }

    private ChatModel createAnthropicModel() {
        var builder = AnthropicChatModel.builder()
                .apiKey(settings.getApiKey())
                .modelName(settings.getModel())
                .maxRetries(0)
                .maxTokens(settings.getMaxTokens())
                .timeout(settings.getRequestTimeout());
        if (settings.getBaseUrl() != null && !settings.getBaseUrl().isBlank()) {
            builder.baseUrl(settings.getBaseUrl());
        }
        if (settings.getTemperature() != null) {
            builder.temperature(settings.getTemperature());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(String provider) {
        String apiKey = settings.getApiKey();
        if ((apiKey == null || apiKey.isBlank()) && "ollama".equals(provider)) {
            apiKey = "ollama";
        }
        var builder = OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(settings.getModel())
                .maxRetries(0)
                .maxTokens(settings.getMaxTokens())
                .timeout(settings.getRequestTimeout());
        String baseUrl = settings.getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = DEFAULT_BASE_URLS.get(provider);
        }
        if (baseUrl != null) {
            builder.baseUrl(baseUrl);
        }
        if (settings.getTemperature() != null) {
            builder.temperature(settings.getTemperature());
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        String provider = settings.getProvider();
        return provider == null ? PROVIDER_OPENAI : provider.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String getCurrentModel() {
        return settings.getModel();
    }

    @Override
    public boolean isAvailable() {
        return "ollama".equals(getProviderId())
                || (settings.getApiKey() != null && !settings.getApiKey().isBlank());
    }

    @Override
    public CompletableFuture<String> send(List<Message> contextSnapshot) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            List<ChatMessage> messages = convertMessages(contextSnapshot);
            int maxRetries = settings.getMaxRetries();
            for (int attempt = 0; attempt <= maxRetries; attempt++) {
                try {
                    ChatResponse response = chatModel.chat(messages);
                    AiMessage aiMessage = response.aiMessage();
                    String text = aiMessage != null ? aiMessage.text() : null;
                    if (text == null || text.isBlank()) {
                        throw new LanguageModelException("Language model returned an empty reply");
                    }
                    return text;
                } catch (LanguageModelException e) {
                    throw e;
                } catch (RuntimeException e) {
                    if (isRateLimitError(e) && attempt < maxRetries) {
                        long backoffMs = (long) (settings.getInitialBackoffMs()
                                * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms...",
                                attempt + 1, maxRetries, backoffMs);
                        sleep(backoffMs);
                    } else {
                        log.error("[LLM] Chat failed", e);
                        throw new LanguageModelException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new LanguageModelException("LLM chat failed: max retries exhausted");
        });
    }

    void sleep(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new LanguageModelException("LLM chat interrupted during retry backoff", ie);
        }
    }

    static boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429") || msg.contains("token_quota_exceeded"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Tool results go back as user turns since the protocol is plain text.
     */
    static List<ChatMessage> convertMessages(List<Message> snapshot) {
        List<ChatMessage> messages = new ArrayList<>();
        for (Message msg : snapshot) {
            String content = msg.getContent() == null ? "" : msg.getContent();
            switch (msg.getRole()) {
            case Message.ROLE_SYSTEM -> messages.add(SystemMessage.from(content));
            case Message.ROLE_ASSISTANT -> messages.add(AiMessage.from(content));
            case Message.ROLE_TOOL -> messages.add(UserMessage.from(TOOL_RESULT_PREFIX + content));
            default -> messages.add(UserMessage.from(content));
            }
        }
        return messages;
    }
}
