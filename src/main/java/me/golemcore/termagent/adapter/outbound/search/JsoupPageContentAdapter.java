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
import me.golemcore.termagent.infrastructure.config.AgentProperties;
import me.golemcore.termagent.port.outbound.PageContentPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Fetches a page and extracts its main readable text.
 */
@Component
@Slf4j
public class JsoupPageContentAdapter implements PageContentPort {

    private static final String NOISE_SELECTOR = "script, style, nav, header, footer, aside, iframe, noscript, form";
    private static final List<String> MAIN_SELECTORS = List.of("article", "[role=main]", "main", ".post-content",
            ".content", "#content", ".entry-content");

    private final OkHttpClient httpClient;
    private final AgentProperties.WebSearchProperties settings;

    public JsoupPageContentAdapter(OkHttpClient httpClient, AgentProperties properties) {
        this.httpClient = httpClient;
        this.settings = properties.getWebSearch();
    }

    @Override
    public Optional<String> fetchText(String url) {
        Request request;
        try {
            request = new Request.Builder()
                    .url(url)
                    .header("User-Agent", settings.getUserAgent())
                    .header("Accept", "text/html,application/xhtml+xml,text/plain;q=0.9")
                    .build();
        } catch (IllegalArgumentException e) {
            log.debug("[Fetch] Skipping invalid URL {}: {}", url, e.getMessage());
            return Optional.empty();
        }
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                log.debug("[Fetch] {} returned HTTP {}", url, response.code());
                return Optional.empty();
            }
            MediaType type = body.contentType();
            String raw = body.string();
            String text = type != null && "plain".equals(type.subtype()) ? raw.strip() : extractText(raw, url);
            return text.isBlank() ? Optional.empty() : Optional.of(truncate(text));
        } catch (IOException e) {
            log.debug("[Fetch] Failed to fetch {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    static String extractText(String html, String baseUri) {
        Document document = Jsoup.parse(html, baseUri);
        document.select(NOISE_SELECTOR).remove();
        for (String selector : MAIN_SELECTORS) {
            Element main = document.selectFirst(selector);
            if (main != null && !main.text().isBlank()) {
                return main.text();
            }
        }
        return document.body() != null ? document.body().text() : document.text();
    }

    private String truncate(String text) {
        int max = settings.getMaxContentLength();
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
