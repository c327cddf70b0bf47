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

package me.golemcore.termagent.port.outbound;

import me.golemcore.termagent.domain.exception.LanguageModelException;
import me.golemcore.termagent.domain.exception.UserInterruptException;
import me.golemcore.termagent.domain.model.Message;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Port for the language model backend. Stateless per call: the caller always
 * supplies the full windowed context. Retries on transient failures belong to
 * the implementation; a failed future means the call is terminally lost.
 */
public interface LanguageModelPort {

    /**
     * Returns the provider identifier (e.g., "openai", "anthropic").
     */
    String getProviderId();

    /**
     * Sends the context snapshot and returns the raw text of the reply.
     */
    CompletableFuture<String> send(List<Message> contextSnapshot);

    /**
     * Blocking variant of {@link #send(List)} for the single-threaded loop.
     *
     * @throws LanguageModelException
     *             if the call failed terminally
     * @throws UserInterruptException
     *             if the waiting thread was interrupted
     */
    default String sendAndWait(List<Message> contextSnapshot) {
        CompletableFuture<String> reply = send(contextSnapshot);
        try {
            return reply.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof LanguageModelException lme) {
                throw lme;
            }
            throw new LanguageModelException("Language model call failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            reply.cancel(true);
            Thread.currentThread().interrupt();
            throw new UserInterruptException("Interrupted while waiting for the model", e);
        }
    }

    /**
     * Returns the model identifier used by this provider.
     */
    String getCurrentModel();

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
