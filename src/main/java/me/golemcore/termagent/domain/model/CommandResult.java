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

import java.time.Duration;

/**
 * Outcome of one command run by an execution backend.
 */
public record CommandResult(int exitCode, String stdout, String stderr, boolean timedOut, Duration duration) {

    public static final int TIMEOUT_EXIT_CODE = -1;

    public boolean isSuccess() {
        return !timedOut && exitCode == 0;
    }

    public static CommandResult timeout(String stdout, String stderr, Duration duration) {
        return new CommandResult(TIMEOUT_EXIT_CODE, stdout, stderr, true, duration);
    }
}
