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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.termagent.domain.exception.MalformedToolCallException;
import me.golemcore.termagent.domain.exception.UnrecoverableResponseException;
import me.golemcore.termagent.domain.model.Message;
import me.golemcore.termagent.domain.model.ResponseDefect;
import me.golemcore.termagent.domain.model.ToolInvocation;
import me.golemcore.termagent.domain.model.ValidatedResponse;
import me.golemcore.termagent.infrastructure.config.AgentProperties;
import me.golemcore.termagent.port.outbound.LanguageModelPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates model replies into tool invocations with a bounded self-correction
 * loop. The first reply counts as attempt one; each failed attempt is answered
 * with a corrective prompt naming the defect, until the attempt ceiling is
 * reached.
 *
 * <p>
 * Rejected replies and corrective prompts are sent to the model but never
 * written to the session context.
 */
@Service
@Slf4j
public class ResponseValidator {

    private static final int SAMPLE_LENGTH = 200;

    private final ToolCallParser parser;
    private final LanguageModelPort languageModel;
    private final int maxAttempts;

    public ResponseValidator(ToolCallParser parser, LanguageModelPort languageModel, AgentProperties properties) {
        this.parser = parser;
        this.languageModel = languageModel;
        this.maxAttempts = Math.max(1, properties.getOrchestrator().getMaxValidationAttempts());
    }

    /**
     * @param rawModelOutput
     *            the reply to validate
     * @param contextSnapshot
     *            the windowed context the reply was produced from, reused for
     *            corrective requests
     * @throws UnrecoverableResponseException
     *             when every attempt was invalid
     */
    public ValidatedResponse validate(String rawModelOutput, List<Message> contextSnapshot) {
        String current = rawModelOutput;
        ResponseDefect lastDefect = null;
        for (int attempt = 1;; attempt++) {
            try {
                ToolInvocation invocation = parser.parse(current);
                if (attempt > 1) {
                    log.info("[Validator] Model corrected its reply on attempt {}", attempt);
                }
                return new ValidatedResponse(invocation, current, attempt);
            } catch (MalformedToolCallException e) {
                lastDefect = e.getDefect();
                log.warn("[Validator] Attempt {}/{} rejected: {}", attempt, maxAttempts, lastDefect.describe());
            }
            if (attempt >= maxAttempts) {
                throw new UnrecoverableResponseException(attempt, lastDefect);
            }
            List<Message> corrective = new ArrayList<>(contextSnapshot);
            corrective.add(Message.assistant(current));
            corrective.add(Message.user(buildCorrectivePrompt(lastDefect, current)));
            current = languageModel.sendAndWait(corrective);
        }
    }

    String buildCorrectivePrompt(ResponseDefect defect, String rejectedOutput) {
        String sample = rejectedOutput == null ? "" : rejectedOutput.strip();
        if (sample.length() > SAMPLE_LENGTH) {
            sample = sample.substring(0, SAMPLE_LENGTH) + "...";
        }
        return "Your previous reply could not be used. " + defect.describe() + "\n"
                + "Reply received (start): " + sample + "\n\n"
                + "Reply again with exactly one JSON object and nothing else, for example:\n"
                + "{\"tool\": \"execute_command\", \"arguments\": {\"command\": \"ls -la\", \"explain\": \"...\"}}\n"
                + hintFor(defect);
    }

    private static String hintFor(ResponseDefect defect) {
        return switch (defect.kind()) {
        case MALFORMED_STRUCTURE -> "Do not wrap the JSON in prose; escape quotes and newlines inside strings.";
        case UNKNOWN_TOOL -> "Use one of the tool names listed in the system prompt.";
        case MISSING_ARGUMENT, INVALID_ARGUMENT -> "Check the argument names and types required by the tool.";
        };
    }
}
