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

package me.golemcore.termagent.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the agent, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code agent.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - language model provider settings</li>
 * <li>{@link ExecutionProperties} - command timeouts and the execution
 * kill-switch</li>
 * <li>{@link SecurityProperties} - extra risk patterns</li>
 * <li>{@link OrchestratorProperties} - step limit, mode and validation
 * retries</li>
 * <li>{@link ContextProperties} - sliding window and rolling memory</li>
 * <li>{@link WebSearchProperties} - search engines and fetch limits</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private LlmProperties llm = new LlmProperties();
    private ExecutionProperties execution = new ExecutionProperties();
    private SecurityProperties security = new SecurityProperties();
    private OrchestratorProperties orchestrator = new OrchestratorProperties();
    private ContextProperties context = new ContextProperties();
    private WebSearchProperties webSearch = new WebSearchProperties();
    private ChatProperties chat = new ChatProperties();
    private PromptCreatorProperties promptCreator = new PromptCreatorProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String provider = "openai";
        private String model = "gpt-4o-mini";
        private String apiKey;
        private String baseUrl;
        private Double temperature = 0.2;
        private Duration requestTimeout = Duration.ofSeconds(120);
        private int maxRetries = 5;
        private long initialBackoffMs = 5000;
        private int maxTokens = 4096;
    }

    // ==================== EXECUTION ====================

    @Data
    public static class ExecutionProperties {
        private boolean commandExecutionEnabled = true;
        private int localTimeoutSeconds = 30;
        private int remoteTimeoutSeconds = 60;
        private int maxTimeoutSeconds = 300;
        private int maxOutputChars = 100_000;
        private String shell = "/bin/sh";
        private String sshBinary = "ssh";
        private String sshControlPersist = "10m";
        private int sshConnectTimeoutSeconds = 15;
    }

    // ==================== SECURITY ====================

    @Data
    public static class SecurityProperties {
        private List<String> dangerousPatterns = new ArrayList<>();
        private List<String> cautionPatterns = new ArrayList<>();
    }

    // ==================== ORCHESTRATOR ====================

    @Data
    public static class OrchestratorProperties {
        private int stepLimit = 50;
        private String mode = "confirm-each";
        private int maxValidationAttempts = 3;
        private boolean planReviewEnabled = true;
        private String deepAnalysis = "ask";
        private boolean continuationEnabled = true;
    }

    // ==================== CONTEXT ====================

    @Data
    public static class ContextProperties {
        private int windowSize = 20;
        private int maxEstimatedTokens = 24_000;
        private int minMessagesBeforeSummary = 3;
        private int summaryCharLimit = 5000;
        private boolean modelSummaryEnabled = true;
    }

    // ==================== WEB SEARCH ====================

    @Data
    public static class WebSearchProperties {
        private String engine = "duckduckgo";
        private String duckduckgoUrl = "https://html.duckduckgo.com";
        private String searxngUrl = "http://localhost:8888";
        private int maxIterations = 5;
        private int maxSources = 5;
        private double minConfidence = 0.7;
        private int maxContentLength = 10_000;
        private int maxConcurrentFetches = 5;
        private Duration fetchTimeout = Duration.ofSeconds(30);
        private boolean modelEvaluationEnabled = true;
        private boolean modelSummaryEnabled = true;
        private String userAgent = "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) "
                + "Chrome/124.0 Safari/537.36";
    }

    // ==================== CHAT & PROMPT CREATOR ====================

    @Data
    public static class ChatProperties {
        private int historyMessages = 20;
    }

    @Data
    public static class PromptCreatorProperties {
        private int maxIterations = 20;
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private String basePath = System.getProperty("user.home") + "/.term-agent";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
