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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Post-run deep analysis of a finished session.
 */
public record AnalysisReport(String goalAchievement, String executionSummary, List<String> successes,
        List<String> failures, String technicalAnalysis, List<String> recommendations, Verdict verdict) {

    public enum Verdict {
        COMPLETED("completed"), PARTIALLY_COMPLETED("partially-completed"), FAILED("failed");

        private final String wireName;

        Verdict(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }

        @JsonCreator
        public static Verdict fromWireName(String value) {
            if (value == null) {
                throw new IllegalArgumentException("Verdict is required");
            }
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
            for (Verdict verdict : values()) {
                if (verdict.wireName.equals(normalized)) {
                    return verdict;
                }
            }
            if (normalized.startsWith("partial")) {
                return PARTIALLY_COMPLETED;
            }
            throw new IllegalArgumentException("Unknown verdict: " + value);
        }
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("## Goal achievement\n").append(goalAchievement).append("\n\n");
        sb.append("## Execution summary\n").append(executionSummary).append("\n\n");
        appendList(sb, "Successes", successes);
        appendList(sb, "Failures", failures);
        sb.append("## Technical analysis\n").append(technicalAnalysis).append("\n\n");
        appendList(sb, "Recommendations", recommendations);
        sb.append("## Verdict\n").append(verdict.wireName()).append('\n');
        return sb.toString();
    }

    private static void appendList(StringBuilder sb, String title, List<String> items) {
        sb.append("## ").append(title).append('\n');
        if (items == null || items.isEmpty()) {
            sb.append("- none\n\n");
            return;
        }
        items.forEach(item -> sb.append("- ").append(item).append('\n'));
        sb.append('\n');
    }
}
