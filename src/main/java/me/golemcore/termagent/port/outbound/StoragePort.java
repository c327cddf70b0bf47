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

import java.util.concurrent.CompletableFuture;

/**
 * Port for persistent storage under the agent's state directory, organized by
 * subdirectory ("plans", "reports").
 */
public interface StoragePort {

    /**
     * Read text content from file, or {@code null} if it does not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Atomically write text content: write to a temporary file, then rename it
     * over the target.
     *
     * @param directory
     *            subdirectory (e.g., "plans", "reports")
     * @param path
     *            relative path within directory
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content);
}
