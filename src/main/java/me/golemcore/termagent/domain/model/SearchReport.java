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

package me.golemcore.termagent.domain.model;

import java.util.List;

/**
 * Aggregated result of a web search run. Sources are sorted by relevance,
 * highest first.
 */
public record SearchReport(String query, boolean success, String summary, List<WebSource> sources,
        double confidence, int iterationsUsed, List<String> followUpSuggestions) {

    public static SearchReport empty(String query, String reason) {
        return new SearchReport(query, false, reason, List.of(), 0.0, 0, List.of());
    }
}
