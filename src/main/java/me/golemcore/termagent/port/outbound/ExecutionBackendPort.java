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

import me.golemcore.termagent.domain.model.CommandResult;
import me.golemcore.termagent.domain.model.ExecutionTarget;
import me.golemcore.termagent.domain.model.RemoteHost;

import java.time.Duration;

/**
 * Port for running shell commands locally or on a remote host.
 */
public interface ExecutionBackendPort {

    /**
     * Runs a command and blocks until it exits or the timeout expires. A timed-out
     * or interrupted command is terminated before this method returns.
     *
     * @throws me.golemcore.termagent.domain.exception.ExecutionBackendException
     *             if the backend itself failed (process could not start, remote
     *             transport lost)
     * @throws me.golemcore.termagent.domain.exception.UserInterruptException
     *             if the calling thread was interrupted while waiting
     */
    CommandResult run(String command, Duration timeout, ExecutionTarget target);

    /**
     * Opens the long-lived authenticated connection used for every remote call
     * of a session.
     */
    ExecutionTarget connect(RemoteHost host);

    /**
     * Closes a connection opened by {@link #connect(RemoteHost)}. Local targets
     * are ignored.
     */
    void disconnect(ExecutionTarget target);
}
