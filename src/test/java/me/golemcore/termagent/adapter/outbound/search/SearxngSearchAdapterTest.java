package me.golemcore.termagent.adapter.outbound.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.termagent.domain.model.SearchHit;
import me.golemcore.termagent.infrastructure.config.AgentProperties;
import me.golemcore.termagent.infrastructure.http.FeignClientFactory;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SearxngSearchAdapterTest {

    private MockWebServer mockServer;
    private SearxngSearchAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        AgentProperties properties = new AgentProperties();
        properties.getWebSearch().setSearxngUrl(mockServer.url("").toString().replaceAll("/$", ""));
        adapter = new SearxngSearchAdapter(new FeignClientFactory(new OkHttpClient(), new ObjectMapper()),
                properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    @Test
    void searchMapsJsonResultsAndSkipsEntriesWithoutUrl() throws Exception {
        mockServer.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("""
                        {"query": "nginx", "results": [
                          {"url": "https://nginx.org", "title": "nginx", "content": "web server", "score": 3.2},
                          {"url": "", "title": "broken"},
                          {"url": "https://example.com/nginx", "title": "Guide"}
                        ]}
                        """));

        List<SearchHit> hits = adapter.search("nginx config", 5);

        assertEquals(2, hits.size());
        assertEquals("web server", hits.get(0).snippet());
        assertEquals("", hits.get(1).snippet());
        assertEquals("searxng", hits.get(0).engine());

        RecordedRequest request = mockServer.takeRequest();
        assertTrue(request.getPath().startsWith("/search?q=nginx"));
        assertTrue(request.getPath().endsWith("&format=json"));
    }

    @Test
    void searchReturnsEmptyListWithoutResults() {
        mockServer.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody("{}"));

        assertTrue(adapter.search("nothing", 5).isEmpty());
    }
}
