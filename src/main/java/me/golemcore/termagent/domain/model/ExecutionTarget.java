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

import java.nio.file.Path;

/**
 * Where commands and file operations run. A remote target carries the control
 * socket of the session's multiplexed SSH connection.
 */
public record ExecutionTarget(RemoteHost remoteHost, Path controlPath) {

    private static final ExecutionTarget LOCAL = new ExecutionTarget(null, null);

    public static ExecutionTarget local() {
        return LOCAL;
    }

    public static ExecutionTarget remote(RemoteHost host, Path controlPath) {
        return new ExecutionTarget(host, controlPath);
    }

    public boolean isRemote() {
        return remoteHost != null;
    }

    public String describe() {
        return isRemote() ? remoteHost.toString() : "localhost";
    }
}
