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

import me.golemcore.termagent.domain.model.WebSource;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keyword-overlap scoring.
 *
 * <ul>
 * <li>relevance: share of query words (3+ letters) found in title and content,
 * times 1.2 when more than one matches, capped at 1.0</li>
 * <li>confidence: {@code 0.5 * avgRelevance + 0.3 * min(1, n / 5) + 0.2 * min(1, avgLength / 2000)}</li>
 * </ul>
 */
@Component
public class KeywordRelevancePolicy implements RelevancePolicy {

    static final double STRONG_RELEVANCE = 0.7;
    private static final double NO_KEYWORDS_RELEVANCE = 0.5;
    private static final double MULTI_MATCH_BOOST = 1.2;
    private static final int MIN_QUERY_WORD = 3;
    private static final int MIN_REFINEMENT_WORD = 4;
    private static final double SOURCE_COUNT_SATURATION = 5.0;
    private static final double CONTENT_LENGTH_SATURATION = 2000.0;
    private static final Set<String> STOP_WORDS = Set.of("with", "from", "that", "this", "your", "have", "what",
            "when", "where", "which", "will", "about", "into", "using", "how", "the", "and", "for");

    @Override
    public double relevance(String query, String title, String content) {
        Set<String> words = queryWords(query);
        if (words.isEmpty()) {
            return NO_KEYWORDS_RELEVANCE;
        }
        if (content == null || content.isBlank()) {
            return 0.0;
        }
        String text = ((title == null ? "" : title) + " " + content).toLowerCase(Locale.ROOT);
        long matches = words.stream().filter(text::contains).count();
        double score = (double) matches / words.size();
        if (matches > 1) {
            score = Math.min(1.0, score * MULTI_MATCH_BOOST);
        }
        return round(score);
    }

    @Override
    public double confidence(Collection<WebSource> sources) {
        if (sources.isEmpty()) {
            return 0.0;
        }
        double avgRelevance = sources.stream().mapToDouble(WebSource::relevance).average().orElse(0.0);
        double avgLength = sources.stream()
                .mapToInt(source -> source.content() == null ? 0 : source.content().length())
                .average().orElse(0.0);
        double countFactor = Math.min(1.0, sources.size() / SOURCE_COUNT_SATURATION);
        double depthFactor = Math.min(1.0, avgLength / CONTENT_LENGTH_SATURATION);
        return round(avgRelevance * 0.5 + countFactor * 0.3 + depthFactor * 0.2);
    }

    @Override
    public String refineQuery(String originalQuery, Collection<WebSource> sources) {
        boolean anyStrong = sources.stream().anyMatch(source -> source.relevance() >= STRONG_RELEVANCE);
        if (!anyStrong) {
            return originalQuery + " guide tutorial";
        }
        Set<String> known = queryWords(originalQuery);
        Map<String, Integer> counts = new HashMap<>();
        for (WebSource source : sources) {
            if (source.title() == null) {
                continue;
            }
            for (String word : source.title().toLowerCase(Locale.ROOT).split("\\W+")) {
                if (word.length() >= MIN_REFINEMENT_WORD && !known.contains(word) && !STOP_WORDS.contains(word)) {
                    counts.merge(word, 1, Integer::sum);
                }
            }
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .map(entry -> originalQuery + " " + entry.getKey())
                .findFirst()
                .orElse(originalQuery + " examples");
    }

    @Override
    public List<String> followUpSuggestions(String originalQuery, Collection<WebSource> sources) {
        if (sources.isEmpty()) {
            return List.of(originalQuery + " documentation", "rephrase: " + originalQuery);
        }
        return List.of(originalQuery + " best practices", originalQuery + " troubleshooting",
                originalQuery + " examples");
    }

    static Set<String> queryWords(String query) {
        if (query == null) {
            return Set.of();
        }
        return Arrays.stream(query.toLowerCase(Locale.ROOT).split("\\W+"))
                .filter(word -> word.length() >= MIN_QUERY_WORD)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
