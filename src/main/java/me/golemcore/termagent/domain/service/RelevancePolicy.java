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

import java.util.Collection;
import java.util.List;

/**
 * Scoring used by the web search agent to rate sources, decide when enough has
 * been found and steer the next query.
 */
public interface RelevancePolicy {

    /**
     * Relevance of one page to the query, between 0.0 and 1.0.
     */
    double relevance(String query, String title, String content);

    /**
     * Overall confidence in a set of sources, between 0.0 and 1.0.
     */
    double confidence(Collection<WebSource> sources);

    String refineQuery(String originalQuery, Collection<WebSource> sources);

    List<String> followUpSuggestions(String originalQuery, Collection<WebSource> sources);
}
