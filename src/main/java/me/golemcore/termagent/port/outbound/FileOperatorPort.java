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

import me.golemcore.termagent.domain.model.ExecutionTarget;
import me.golemcore.termagent.domain.model.ToolInvocation;

/**
 * Port for file-system primitives on the session target. Each method is one
 * synchronous call returning a human-readable result; failures are reported as
 * {@link me.golemcore.termagent.domain.exception.FileOperationException}.
 * Confirmation is the caller's responsibility.
 */
public interface FileOperatorPort {

    String read(ExecutionTarget target, String path, Integer startLine, Integer endLine);

    String write(ExecutionTarget target, String path, String content);

    String edit(ExecutionTarget target, String path, ToolInvocation.EditAction action, String search,
            String replace, String line);

    String copy(ExecutionTarget target, String source, String destination, boolean overwrite);

    String delete(ExecutionTarget target, String path, boolean backup);

    String list(ExecutionTarget target, String path, boolean recursive, String pattern);
}
