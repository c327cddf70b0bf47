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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a JSON object or array from model output. Tries, in order: the
 * content of a Markdown code fence, the whole text, and the first balanced
 * {@code {...}} or {@code [...]} block. Each candidate is parsed strictly and
 * then with relaxed syntax (single quotes, unquoted names, trailing commas,
 * comments).
 */
@Component
@Slf4j
public class LenientJsonParser {

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json|JSON)?\\s*(.*?)```", Pattern.DOTALL);

    private final ObjectMapper strictMapper;
    private final ObjectMapper lenientMapper;

    public LenientJsonParser(ObjectMapper objectMapper) {
        this.strictMapper = objectMapper;
        this.lenientMapper = JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
                .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
                .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
                .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
                .enable(JsonReadFeature.ALLOW_YAML_COMMENTS)
                .enable(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
                .build();
    }

    public Optional<JsonNode> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        for (String candidate : candidates(raw)) {
            Optional<JsonNode> node = tryParse(candidate);
            if (node.isPresent()) {
                return node;
            }
            Optional<String> block = extractBalancedBlock(candidate);
            if (block.isPresent()) {
                node = tryParse(block.get());
                if (node.isPresent()) {
                    return node;
                }
            }
        }
        return Optional.empty();
    }

    private List<String> candidates(String raw) {
        List<String> candidates = new ArrayList<>();
        Matcher fence = CODE_FENCE.matcher(raw);
        if (fence.find()) {
            candidates.add(fence.group(1).trim());
        }
        candidates.add(raw.trim());
        return candidates;
    }

    private Optional<JsonNode> tryParse(String text) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        char first = text.charAt(0);
        if (first != '{' && first != '[') {
            return Optional.empty();
        }
        try {
            return structured(strictMapper.readTree(text));
        } catch (JsonProcessingException strictFailure) {
            try {
                return structured(lenientMapper.readTree(text));
            } catch (JsonProcessingException lenientFailure) {
                log.debug("[Validator] JSON candidate rejected: {}", lenientFailure.getOriginalMessage());
                return Optional.empty();
            }
        }
    }

    private static Optional<JsonNode> structured(JsonNode node) {
        if (node != null && (node.isObject() || node.isArray())) {
            return Optional.of(node);
        }
        return Optional.empty();
    }

    /**
     * Finds the first {@code {} or {@code [} and returns the text up to its
     * matching close, skipping brackets inside string literals.
     */
    static Optional<String> extractBalancedBlock(String text) {
        int start = -1;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{' || c == '[') {
                start = i;
                break;
            }
        }
        if (start < 0) {
            return Optional.empty();
        }
        int depth = 0;
        char quote = 0;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '{' || c == '[') {
                depth++;
            } else if ((c == '}' || c == ']') && --depth == 0) {
                return Optional.of(text.substring(start, i + 1));
            }
        }
        return Optional.empty();
    }
}
