package me.golemcore.termagent.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.termagent.domain.exception.LanguageModelException;
import me.golemcore.termagent.domain.model.SearchHit;
import me.golemcore.termagent.domain.model.SearchReport;
import me.golemcore.termagent.domain.model.WebSource;
import me.golemcore.termagent.infrastructure.config.AgentProperties;
import me.golemcore.termagent.port.outbound.LanguageModelPort;
import me.golemcore.termagent.port.outbound.PageContentPort;
import me.golemcore.termagent.port.outbound.SearchEnginePort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSearchAgentTest {

    private static final String QUERY = "postgres vacuum tuning";

    private SearchEnginePort primary;
    private SearchEnginePort fallback;
    private PageContentPort pageContent;
    private LanguageModelPort languageModel;
    private AgentProperties properties;
    private WebSearchAgent agent;

    @BeforeEach
    void setUp() {
        primary = mock(SearchEnginePort.class);
        fallback = mock(SearchEnginePort.class);
        pageContent = mock(PageContentPort.class);
        when(primary.getEngineId()).thenReturn("duckduckgo");
        when(fallback.getEngineId()).thenReturn("searxng");
        languageModel = mock(LanguageModelPort.class);
        properties = new AgentProperties();
        agent = new WebSearchAgent(List.of(fallback, primary), pageContent, new KeywordRelevancePolicy(),
                languageModel, new LenientJsonParser(new ObjectMapper()), properties,
                Clock.fixed(Instant.parse("2026-02-11T10:00:00Z"), ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        agent.shutdown();
    }

    private static SearchHit hit(int index, String title) {
        return new SearchHit("https://example.com/" + index, title, "snippet " + index, "duckduckgo");
    }

    @Test
    void shouldStopWhenConfidenceReached() {
        // Arrange
        when(primary.search(anyString(), anyInt())).thenReturn(List.of(hit(1, "Postgres vacuum tuning"),
                hit(2, "Vacuum tuning in Postgres"), hit(3, "Tuning autovacuum for postgres"),
                hit(4, "Postgres vacuum"), hit(5, "Tuning postgres vacuum")));
        when(pageContent.fetchText(anyString()))
                .thenReturn(Optional.of("postgres vacuum tuning explained ".repeat(80)));

        // Act
        SearchReport report = agent.search(QUERY, null);

        // Assert
        assertTrue(report.success());
        assertEquals(1, report.iterationsUsed());
        assertEquals(5, report.sources().size());
        assertTrue(report.confidence() >= 0.7);
        verify(fallback, never()).search(anyString(), anyInt());
    }

    @Test
    void shouldFallBackToNextEngineWhenPreferredFails() {
        // Arrange
        when(primary.search(anyString(), anyInt())).thenThrow(new IllegalStateException("HTTP 429"));
        when(fallback.search(anyString(), anyInt())).thenReturn(List.of(hit(1, "Postgres vacuum tuning")));
        when(pageContent.fetchText(anyString())).thenReturn(Optional.empty());

        // Act
        SearchReport report = agent.search(QUERY, 3, 5, 0.0);

        // Assert
        assertTrue(report.success());
        assertEquals("snippet 1", report.sources().get(0).content());
    }

    @Test
    void shouldRefineQueryAndIterateWhenConfidenceLow() {
        // Arrange
        when(primary.search(anyString(), anyInt()))
                .thenReturn(List.of(hit(1, "Unrelated page")))
                .thenReturn(List.of(hit(2, "Another page")))
                .thenReturn(List.of());
        when(fallback.search(anyString(), anyInt())).thenReturn(List.of());
        when(pageContent.fetchText(anyString())).thenReturn(Optional.of("nothing useful here"));

        // Act
        SearchReport report = agent.search(QUERY, 3, 5, 0.9);

        // Assert
        assertEquals(3, report.iterationsUsed());
        assertEquals(2, report.sources().size());
        verify(primary, times(2)).search(QUERY + " guide tutorial", 5);
    }

    @Test
    void shouldReportFailureWhenNoEngineReturnsResults() {
        // Arrange
        when(primary.search(anyString(), anyInt())).thenReturn(List.of());
        when(fallback.search(anyString(), anyInt())).thenReturn(List.of());

        // Act
        SearchReport report = agent.search(QUERY, 1, 5, 0.7);

        // Assert
        assertFalse(report.success());
        assertTrue(report.summary().contains("No sources"));
        assertFalse(report.followUpSuggestions().isEmpty());
    }

    @Test
    void shouldRejectBlankQuery() {
        assertThrows(IllegalArgumentException.class, () -> agent.search(" ", null));
    }

    @Test
    void shouldStopEarlyWhenModelJudgesResultsSufficient() {
        // Arrange
        when(primary.search(anyString(), anyInt())).thenReturn(List.of(hit(1, "Unrelated page")));
        when(pageContent.fetchText(anyString())).thenReturn(Optional.of("nothing useful here"));
        when(languageModel.sendAndWait(anyList()))
                .thenReturn("{\"continue\": false, \"reason\": \"enough\", \"refined_query\": \"\"}")
                .thenReturn(null);

        // Act
        SearchReport report = agent.search(QUERY, 3, 5, 0.9);

        // Assert
        assertEquals(1, report.iterationsUsed());
        verify(primary, times(1)).search(anyString(), anyInt());
    }

    @Test
    void shouldUseModelRefinedQueryForNextIteration() {
        // Arrange
        when(primary.search(anyString(), anyInt()))
                .thenReturn(List.of(hit(1, "Unrelated page")))
                .thenReturn(List.of());
        when(fallback.search(anyString(), anyInt())).thenReturn(List.of());
        when(pageContent.fetchText(anyString())).thenReturn(Optional.of("nothing useful here"));
        when(languageModel.sendAndWait(anyList()))
                .thenReturn("```json\n{\"continue\": true, \"reason\": \"gaps\", "
                        + "\"refined_query\": \"autovacuum cost limit\"}\n```")
                .thenReturn(null);

        // Act
        SearchReport report = agent.search(QUERY, 2, 5, 0.9);

        // Assert
        assertEquals(2, report.iterationsUsed());
        verify(primary).search("autovacuum cost limit", 5);
    }

    @Test
    void shouldIgnoreUnusableEvaluationReply() {
        // Arrange
        when(languageModel.sendAndWait(anyList())).thenReturn("Looks fine to me");
        List<WebSource> sources = List.of(new WebSource("https://example.com/1", "Page", "", "text", 0.1, 1));

        // Act
        Optional<WebSearchAgent.Evaluation> evaluation = agent.evaluateWithModel(QUERY, sources, 0.1);

        // Assert
        assertTrue(evaluation.isEmpty());
    }

    @Test
    void shouldWriteSummaryWithModel() {
        // Arrange
        when(primary.search(anyString(), anyInt())).thenReturn(List.of(hit(1, "Postgres vacuum tuning")));
        when(pageContent.fetchText(anyString())).thenReturn(Optional.of("postgres vacuum tuning explained"));
        when(languageModel.sendAndWait(anyList())).thenReturn("Autovacuum should be tuned per table.");

        // Act
        SearchReport report = agent.search(QUERY, 1, 5, 0.0);

        // Assert
        assertTrue(report.summary().startsWith("Autovacuum should be tuned per table."));
        assertTrue(report.summary().contains("<https://example.com/1>"));
    }

    @Test
    void shouldFallBackToSourceListingWhenModelSummaryFails() {
        // Arrange
        when(primary.search(anyString(), anyInt())).thenReturn(List.of(hit(1, "Postgres vacuum tuning")));
        when(pageContent.fetchText(anyString())).thenReturn(Optional.of("postgres vacuum tuning explained"));
        when(languageModel.sendAndWait(anyList())).thenThrow(new LanguageModelException("quota exceeded"));

        // Act
        SearchReport report = agent.search(QUERY, 1, 5, 0.0);

        // Assert
        assertTrue(report.summary().startsWith("Found 1 source(s)"));
    }

    @Test
    void shouldNotCallModelWhenModelAssistanceDisabled() {
        // Arrange
        properties.getWebSearch().setModelEvaluationEnabled(false);
        properties.getWebSearch().setModelSummaryEnabled(false);
        when(primary.search(anyString(), anyInt())).thenReturn(List.of(hit(1, "Unrelated page")));
        when(pageContent.fetchText(anyString())).thenReturn(Optional.of("nothing useful here"));

        // Act
        agent.search(QUERY, 2, 5, 0.9);

        // Assert
        verify(languageModel, never()).sendAndWait(anyList());
    }
}
