package me.golemcore.termagent.domain.service;

import me.golemcore.termagent.domain.model.WebSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeywordRelevancePolicyTest {

    private static final String QUERY = "nginx reverse proxy config";

    private final KeywordRelevancePolicy policy = new KeywordRelevancePolicy();

    private static WebSource source(String title, double relevance, int contentLength) {
        return new WebSource("https://example.com/" + title.hashCode(), title, "", "a".repeat(contentLength),
                relevance, 1);
    }

    @Test
    void shouldScoreShareOfMatchedWordsWithBoost() {
        assertEquals(0.6, policy.relevance(QUERY, "Nginx guide", "Setting up a proxy"));
        assertEquals(0.25, policy.relevance(QUERY, "", "all about nginx"));
        assertEquals(1.0, policy.relevance(QUERY, "Nginx reverse proxy", "config reference"));
    }

    @Test
    void shouldScoreEmptyContentAsIrrelevant() {
        assertEquals(0.0, policy.relevance(QUERY, "Nginx reverse proxy config", ""));
    }

    @Test
    void shouldUseNeutralScoreWhenQueryHasNoKeywords() {
        assertEquals(0.5, policy.relevance("a b c", "title", "content"));
    }

    @Test
    void shouldCombineRelevanceCountAndDepthIntoConfidence() {
        // Act
        double confidence = policy.confidence(List.of(source("one", 1.0, 2000)));

        // Assert
        assertEquals(0.76, confidence);
        assertEquals(0.0, policy.confidence(List.of()));
    }

    @Test
    void shouldBroadenQueryWhenNothingRelevant() {
        assertEquals(QUERY + " guide tutorial", policy.refineQuery(QUERY, List.of(source("misc", 0.2, 10))));
    }

    @Test
    void shouldRefineWithMostCommonTitleWord() {
        // Arrange
        List<WebSource> sources = List.of(source("Nginx upstream keepalive", 0.9, 100),
                source("Tuning upstream servers", 0.4, 100));

        // Act
        String refined = policy.refineQuery(QUERY, sources);

        // Assert
        assertEquals(QUERY + " upstream", refined);
    }

    @Test
    void shouldIgnoreShortWordsInQuery() {
        assertTrue(KeywordRelevancePolicy.queryWords("how to use jq on a file").containsAll(List.of("how", "use")));
        assertEquals(List.of("how", "use", "file"),
                List.copyOf(KeywordRelevancePolicy.queryWords("how to use jq on a file")));
    }
}
