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

/**
 * Machine-readable classification of tool execution failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * The user refused the effect; the error carries their justification.
     */
    CONFIRMATION_DENIED,

    /**
     * Rejected by configuration (command execution disabled).
     */
    POLICY_DENIED,

    /**
     * The effect ran and failed (non-zero exit, I/O error, search failure).
     */
    EXECUTION_FAILED,

    /**
     * The command did not finish within its timeout and was terminated.
     */
    TIMEOUT,

    /**
     * {@code finish} was called while plan steps were still unresolved.
     */
    INCOMPLETE_PLAN,

    /**
     * Arguments referred to something that does not exist or an invalid step
     * transition.
     */
    INVALID_ARGUMENT,

    /**
     * The tool cannot be used in the current execution mode.
     */
    UNAVAILABLE,

    /**
     * The user interrupted a prompt or a running command.
     */
    INTERRUPTED
}
