package me.golemcore.termagent.adapter.outbound.search;

import me.golemcore.termagent.domain.model.SearchHit;
import me.golemcore.termagent.infrastructure.config.AgentProperties;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DuckDuckGoSearchAdapterTest {

    private static final String RESULTS_HTML = """
            <html><body>
              <div class="result result--ad">
                <a class="result__a" href="https://ads.example.com">Sponsored</a>
              </div>
              <div class="result">
                <a class="result__a" href="//duckduckgo.com/l/?uddg=https%3A%2F%2Fnginx.org%2Fen%2Fdocs%2F&rut=abc">
                  nginx documentation</a>
                <a class="result__snippet">Official docs for <b>nginx</b>.</a>
              </div>
              <div class="result">
                <a class="result__a" href="https://wiki.debian.org/Nginx">Nginx - Debian Wiki</a>
              </div>
            </body></html>
            """;

    private MockWebServer mockServer;
    private DuckDuckGoSearchAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        AgentProperties properties = new AgentProperties();
        properties.getWebSearch().setDuckduckgoUrl(mockServer.url("").toString().replaceAll("/$", ""));
        adapter = new DuckDuckGoSearchAdapter(new OkHttpClient(), properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    @Test
    void searchPostsQueryAndParsesOrganicResults() throws Exception {
        mockServer.enqueue(new MockResponse().setBody(RESULTS_HTML).setHeader("Content-Type", "text/html"));

        List<SearchHit> hits = adapter.search("install nginx", 5);

        assertEquals(2, hits.size());
        assertEquals("https://nginx.org/en/docs/", hits.get(0).url());
        assertEquals("nginx documentation", hits.get(0).title());
        assertEquals("Official docs for nginx.", hits.get(0).snippet());
        assertEquals("", hits.get(1).snippet());
        assertEquals("duckduckgo", hits.get(1).engine());

        RecordedRequest request = mockServer.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/html/", request.getPath());
        assertEquals("q=install%20nginx", request.getBody().readUtf8());
    }

    @Test
    void searchHonorsMaxResults() {
        mockServer.enqueue(new MockResponse().setBody(RESULTS_HTML));

        assertEquals(1, adapter.search("nginx", 1).size());
    }

    @Test
    void searchFailsOnHttpError() {
        mockServer.enqueue(new MockResponse().setResponseCode(503));

        assertThrows(IllegalStateException.class, () -> adapter.search("nginx", 5));
    }

    @Test
    void searchWrapsConnectionFailure() throws IOException {
        mockServer.shutdown();

        assertThrows(UncheckedIOException.class, () -> adapter.search("nginx", 5));
    }

    @Test
    void decodeRedirectHandlesPlainAndProtocolRelativeLinks() {
        assertEquals("https://example.com/a b", DuckDuckGoSearchAdapter.decodeRedirect(
                "/l/?uddg=https%3A%2F%2Fexample.com%2Fa%20b"));
        assertEquals("https://example.com/x", DuckDuckGoSearchAdapter.decodeRedirect("//example.com/x"));
        assertEquals("https://example.com", DuckDuckGoSearchAdapter.decodeRedirect("https://example.com"));
    }
}
