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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.termagent.domain.model.SearchHit;
import me.golemcore.termagent.infrastructure.config.AgentProperties;
import me.golemcore.termagent.infrastructure.http.FeignClientFactory;
import me.golemcore.termagent.port.outbound.SearchEnginePort;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Queries a self-hosted SearXNG instance through its JSON API.
 */
@Component
@Slf4j
public class SearxngSearchAdapter implements SearchEnginePort {

    static final String ENGINE_ID = "searxng";

    private final FeignClientFactory feignClientFactory;
    private final String baseUrl;
    private volatile SearxngApi api;

    public SearxngSearchAdapter(FeignClientFactory feignClientFactory, AgentProperties properties) {
        this.feignClientFactory = feignClientFactory;
        this.baseUrl = properties.getWebSearch().getSearxngUrl();
    }

    @Override
    public String getEngineId() {
        return ENGINE_ID;
    }

    @Override
    public List<SearchHit> search(String query, int maxResults) {
        SearxngResponse response = getApi().search(query);
        if (response == null || response.getResults() == null) {
            return List.of();
        }
        List<SearchHit> hits = response.getResults().stream()
                .filter(result -> result.getUrl() != null && !result.getUrl().isBlank())
                .limit(maxResults)
                .map(result -> new SearchHit(result.getUrl(), result.getTitle(),
                        result.getContent() != null ? result.getContent() : "", ENGINE_ID))
                .toList();
        log.debug("[Search] SearXNG returned {} result(s) for '{}'", hits.size(), query);
        return hits;
    }

    private SearxngApi getApi() {
        if (api == null) {
            api = feignClientFactory.create(SearxngApi.class, baseUrl);
        }
        return api;
    }

    // Feign API interface
    interface SearxngApi {
        @RequestLine("GET /search?q={query}&format=json")
        @Headers("Accept: application/json")
        SearxngResponse search(@Param("query") String query);
    }

    // Response DTOs
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SearxngResponse {
        private List<SearxngResult> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SearxngResult {
        private String url;
        private String title;
        private String content;
    }
}
