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
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.termagent.domain.exception.LanguageModelException;
import me.golemcore.termagent.domain.model.Message;
import me.golemcore.termagent.domain.model.SearchHit;
import me.golemcore.termagent.domain.model.SearchReport;
import me.golemcore.termagent.domain.model.WebSource;
import me.golemcore.termagent.infrastructure.config.AgentProperties;
import me.golemcore.termagent.port.outbound.LanguageModelPort;
import me.golemcore.termagent.port.outbound.PageContentPort;
import me.golemcore.termagent.port.outbound.SearchEnginePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Iterative web research. Each iteration queries the configured engine,
 * fetches new result pages in parallel, scores them and stops once confidence
 * reaches the threshold, the iteration budget is spent or twice the requested
 * sources have been gathered. When the heuristics would continue, the model
 * may stop the search early or supply a better follow-up query. The final
 * summary is written by the model, with a plain listing of the sources as
 * fallback. From the caller's side a search is one blocking call.
 */
@Service
@Slf4j
public class WebSearchAgent {

    private static final int SUMMARY_EXCERPT_LENGTH = 300;
    private static final int EVALUATION_EXCERPT_LENGTH = 500;
    private static final int MODEL_SUMMARY_SOURCES = 5;
    private static final int MODEL_SUMMARY_EXCERPT_LENGTH = 1000;
    private static final DateTimeFormatter PROMPT_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final List<SearchEnginePort> engines;
    private final PageContentPort pageContent;
    private final RelevancePolicy relevancePolicy;
    private final LanguageModelPort languageModel;
    private final LenientJsonParser jsonParser;
    private final AgentProperties.WebSearchProperties properties;
    private final Clock clock;
    private final ExecutorService fetchExecutor;

    public WebSearchAgent(List<SearchEnginePort> engines, PageContentPort pageContent,
            RelevancePolicy relevancePolicy, LanguageModelPort languageModel, LenientJsonParser jsonParser,
            AgentProperties properties, Clock clock) {
        this.engines = orderEngines(engines, properties.getWebSearch().getEngine());
        this.pageContent = pageContent;
        this.relevancePolicy = relevancePolicy;
        this.languageModel = languageModel;
        this.jsonParser = jsonParser;
        this.properties = properties.getWebSearch();
        this.clock = clock;
        this.fetchExecutor = Executors.newFixedThreadPool(Math.max(1, this.properties.getMaxConcurrentFetches()),
                runnable -> {
                    Thread thread = new Thread(runnable, "web-fetch");
                    thread.setDaemon(true);
                    return thread;
                });
    }

    @PreDestroy
    public void shutdown() {
        fetchExecutor.shutdownNow();
    }

    public SearchReport search(String query, Integer maxSources) {
        int sources = maxSources != null && maxSources > 0 ? maxSources : properties.getMaxSources();
        return search(query, properties.getMaxIterations(), sources, properties.getMinConfidence());
    }

    public SearchReport search(String query, int maxIterations, int maxSourcesPerIteration, double minConfidence) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Search query must not be empty");
        }
        if (engines.isEmpty()) {
            return SearchReport.empty(query, "No search engine is configured");
        }
        Map<String, WebSource> collected = new LinkedHashMap<>();
        String currentQuery = query;
        double confidence = 0.0;
        int iterationsUsed = 0;

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            iterationsUsed = iteration;
            List<SearchHit> hits = runEngines(currentQuery, maxSourcesPerIteration).stream()
                    .filter(hit -> !collected.containsKey(hit.url()))
                    .limit(maxSourcesPerIteration)
                    .toList();
            for (WebSource source : fetchAll(query, hits, iteration)) {
                collected.putIfAbsent(source.url(), source);
            }
            confidence = relevancePolicy.confidence(collected.values());
            log.info("[WebSearch] Iteration {}/{} for '{}': {} source(s), confidence {}", iteration, maxIterations,
                    currentQuery, collected.size(), confidence);
            if (confidence >= minConfidence || collected.size() >= maxSourcesPerIteration * 2) {
                break;
            }
            if (iteration == maxIterations) {
                break;
            }
            Optional<Evaluation> evaluation = properties.isModelEvaluationEnabled() && !collected.isEmpty()
                    ? evaluateWithModel(query, collected.values(), confidence)
                    : Optional.empty();
            if (evaluation.isPresent() && !evaluation.get().needsMore()) {
                log.info("[WebSearch] Model judged the results sufficient: {}", evaluation.get().reason());
                break;
            }
            currentQuery = evaluation.map(Evaluation::refinedQuery)
                    .filter(refined -> !refined.isBlank())
                    .orElseGet(() -> relevancePolicy.refineQuery(query, collected.values()));
        }

        List<WebSource> sorted = collected.values().stream()
                .sorted(Comparator.comparingDouble(WebSource::relevance).reversed())
                .toList();
        return new SearchReport(query, !sorted.isEmpty(), summarize(query, sorted, confidence), sorted, confidence,
                iterationsUsed, relevancePolicy.followUpSuggestions(query, sorted));
    }

    // ==================== Model assistance ====================

    record Evaluation(boolean needsMore, String reason, String refinedQuery) {
    }

    Optional<Evaluation> evaluateWithModel(String query, Collection<WebSource> sources,
            double confidence) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Analyze the search results for the query: \"").append(query).append("\"\n\n")
                .append("Current date and time: ").append(now()).append("\n\nCurrent search results:\n");
        for (WebSource source : sources) {
            prompt.append("- ").append(source.title()).append(": ")
                    .append(excerpt(source.content(), EVALUATION_EXCERPT_LENGTH)).append('\n');
        }
        prompt.append(String.format("%nConfidence score: %.2f%n%n", confidence))
                .append("Is the information sufficient to answer the query, or are there gaps?\n")
                .append("Respond with JSON only: {\"continue\": true|false, \"reason\": \"...\", ")
                .append("\"refined_query\": \"next search query if continue is true\"}");
        String reply = ask("You are a search result evaluator. Judge whether the results are complete.",
                prompt.toString());
        if (reply == null) {
            return Optional.empty();
        }
        Optional<JsonNode> node = jsonParser.parse(reply).filter(JsonNode::isObject);
        if (node.isEmpty() || !node.get().has("continue")) {
            log.debug("[WebSearch] Ignoring unusable evaluation reply");
            return Optional.empty();
        }
        JsonNode json = node.get();
        return Optional.of(new Evaluation(json.path("continue").asBoolean(false),
                json.path("reason").asText(""), json.path("refined_query").asText("").strip()));
    }

    private String summarize(String query, List<WebSource> sources, double confidence) {
        if (sources.isEmpty() || !properties.isModelSummaryEnabled()) {
            return listSources(query, sources, confidence);
        }
        StringBuilder prompt = new StringBuilder();
        prompt.append("Current date and time: ").append(now()).append("\n\n")
                .append("Summarize the key information from these search results for the query \"")
                .append(query).append("\":\n\n");
        for (WebSource source : sources.subList(0, Math.min(MODEL_SUMMARY_SOURCES, sources.size()))) {
            prompt.append("Source: ").append(source.title()).append('\n')
                    .append("URL: ").append(source.url()).append('\n')
                    .append("Content: ").append(excerpt(source.content(), MODEL_SUMMARY_EXCERPT_LENGTH))
                    .append("\n\n");
        }
        prompt.append("Provide a concise summary of the main findings (2-3 paragraphs).");
        String reply = ask("You are a helpful assistant that summarizes web search results.", prompt.toString());
        if (reply == null) {
            return listSources(query, sources, confidence);
        }
        return reply + "\n\nSources:\n" + sourceIndex(sources);
    }

    private String ask(String systemPrompt, String userPrompt) {
        try {
            String reply = languageModel.sendAndWait(List.of(Message.system(systemPrompt), Message.user(userPrompt)));
            return reply == null || reply.isBlank() ? null : reply.strip();
        } catch (LanguageModelException e) {
            log.warn("[WebSearch] Model call failed, using heuristics: {}", e.getMessage());
            return null;
        }
    }

    private String now() {
        return LocalDateTime.now(clock).format(PROMPT_TIME);
    }

    private List<SearchHit> runEngines(String query, int maxResults) {
        for (SearchEnginePort engine : engines) {
            try {
                List<SearchHit> hits = engine.search(query, maxResults);
                if (!hits.isEmpty()) {
                    return hits;
                }
                log.debug("[WebSearch] {} returned no results for '{}'", engine.getEngineId(), query);
            } catch (RuntimeException e) {
                log.warn("[WebSearch] {} failed for '{}': {}", engine.getEngineId(), query, e.getMessage());
            }
        }
        return List.of();
    }

    private List<WebSource> fetchAll(String query, List<SearchHit> hits, int iteration) {
        long timeoutMs = properties.getFetchTimeout().toMillis();
        List<CompletableFuture<WebSource>> futures = new ArrayList<>();
        for (SearchHit hit : hits) {
            futures.add(CompletableFuture.supplyAsync(() -> fetchSource(query, hit, iteration), fetchExecutor)
                    .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                    .exceptionally(e -> {
                        log.debug("[WebSearch] Fetch of {} failed: {}", hit.url(), e.toString());
                        return toSource(query, hit, hit.snippet(), iteration);
                    }));
        }
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private WebSource fetchSource(String query, SearchHit hit, int iteration) {
        Optional<String> text = pageContent.fetchText(hit.url());
        String content = text.filter(value -> !value.isBlank()).orElse(hit.snippet());
        return toSource(query, hit, content, iteration);
    }

    private WebSource toSource(String query, SearchHit hit, String content, int iteration) {
        String trimmed = content == null ? "" : content;
        if (trimmed.length() > properties.getMaxContentLength()) {
            trimmed = trimmed.substring(0, properties.getMaxContentLength());
        }
        double relevance = relevancePolicy.relevance(query, hit.title(), trimmed);
        return new WebSource(hit.url(), hit.title(), hit.snippet(), trimmed, relevance, iteration);
    }

    static String listSources(String query, List<WebSource> sources, double confidence) {
        if (sources.isEmpty()) {
            return "No sources found for '" + query + "'.";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Found %d source(s) for '%s' (confidence %.2f).%n", sources.size(), query,
                confidence));
        int index = 1;
        for (WebSource source : sources) {
            sb.append(index++).append(". ").append(source.title()).append(" <").append(source.url())
                    .append("> relevance ").append(source.relevance()).append('\n');
            String excerpt = excerpt(source.content(), SUMMARY_EXCERPT_LENGTH);
            if (!excerpt.isEmpty()) {
                sb.append("   ").append(excerpt).append('\n');
            }
        }
        return sb.toString();
    }

    private static String sourceIndex(List<WebSource> sources) {
        StringBuilder sb = new StringBuilder();
        int index = 1;
        for (WebSource source : sources) {
            sb.append(index++).append(". ").append(source.title()).append(" <").append(source.url()).append(">\n");
        }
        return sb.toString();
    }

    private static String excerpt(String content, int limit) {
        String text = content == null ? "" : content.strip().replace('\n', ' ');
        return text.length() > limit ? text.substring(0, limit) + "..." : text;
    }

    private static List<SearchEnginePort> orderEngines(List<SearchEnginePort> engines, String preferred) {
        List<SearchEnginePort> ordered = new ArrayList<>(engines);
        ordered.sort(Comparator.comparing(engine -> !engine.getEngineId().equalsIgnoreCase(preferred)));
        return List.copyOf(ordered);
    }
}
