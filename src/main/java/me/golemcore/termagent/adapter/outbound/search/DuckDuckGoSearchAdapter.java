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

package me.golemcore.termagent.adapter.outbound.search;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.termagent.domain.model.SearchHit;
import me.golemcore.termagent.infrastructure.config.AgentProperties;
import me.golemcore.termagent.port.outbound.SearchEnginePort;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Scrapes the DuckDuckGo HTML endpoint. No API key is needed.
 */
@Component
@Slf4j
public class DuckDuckGoSearchAdapter implements SearchEnginePort {

    static final String ENGINE_ID = "duckduckgo";
    private static final String REDIRECT_PARAM = "uddg=";

    private final OkHttpClient httpClient;
    private final AgentProperties.WebSearchProperties settings;

    public DuckDuckGoSearchAdapter(OkHttpClient httpClient, AgentProperties properties) {
        this.httpClient = httpClient;
        this.settings = properties.getWebSearch();
    }

    @Override
    public String getEngineId() {
        return ENGINE_ID;
    }

    @Override
    public List<SearchHit> search(String query, int maxResults) {
        Request request = new Request.Builder()
                .url(settings.getDuckduckgoUrl() + "/html/")
                .header("User-Agent", settings.getUserAgent())
                .post(new FormBody.Builder().add("q", query).build())
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new IllegalStateException("DuckDuckGo returned HTTP " + response.code());
            }
            List<SearchHit> hits = parseResults(body.string(), maxResults);
            log.debug("[Search] DuckDuckGo returned {} result(s) for '{}'", hits.size(), query);
            return hits;
        } catch (IOException e) {
            throw new UncheckedIOException("DuckDuckGo request failed: " + e.getMessage(), e);
        }
    }

    static List<SearchHit> parseResults(String html, int maxResults) {
        Document document = Jsoup.parse(html);
        List<SearchHit> hits = new ArrayList<>();
        for (Element result : document.select("div.result")) {
            if (hits.size() >= maxResults) {
                break;
            }
            Element link = result.selectFirst("a.result__a");
            if (link == null || result.hasClass("result--ad")) {
                continue;
            }
            String url = decodeRedirect(link.attr("href"));
            if (url.isBlank()) {
                continue;
            }
            Element snippet = result.selectFirst(".result__snippet");
            hits.add(new SearchHit(url, link.text(), snippet != null ? snippet.text() : "", ENGINE_ID));
        }
        return hits;
    }

    /**
     * Result links point at a DuckDuckGo redirect carrying the target in
     * {@code uddg}.
     */
    static String decodeRedirect(String href) {
        int idx = href.indexOf(REDIRECT_PARAM);
        if (idx < 0) {
            return href.startsWith("//") ? "https:" + href : href;
        }
        String encoded = href.substring(idx + REDIRECT_PARAM.length());
        int amp = encoded.indexOf('&');
        if (amp >= 0) {
            encoded = encoded.substring(0, amp);
        }
        return URLDecoder.decode(encoded, StandardCharsets.UTF_8);
    }
}
