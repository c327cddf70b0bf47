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

package me.golemcore.termagent.domain.exception;

import me.golemcore.termagent.domain.model.ResponseDefect;

/**
 * The model kept producing invalid output after every correction attempt.
 */
public class UnrecoverableResponseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int attempts;
    private final transient ResponseDefect lastDefect;

    public UnrecoverableResponseException(int attempts, ResponseDefect lastDefect) {
        super("Model output invalid after " + attempts + " attempt(s): "
                + (lastDefect != null ? lastDefect.describe() : "unknown defect"));
        this.attempts = attempts;
        this.lastDefect = lastDefect;
    }

    public int getAttempts() {
        return attempts;
    }

    public ResponseDefect getLastDefect() {
        return lastDefect;
    }
}
