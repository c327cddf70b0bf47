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
 * SSH destination parsed from {@code user@host} or {@code user@host:port}.
 */
public record RemoteHost(String user, String host, int port) {

    public static final int DEFAULT_PORT = 22;

    public static RemoteHost parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Remote target is empty");
        }
        String trimmed = value.trim();
        int at = trimmed.indexOf('@');
        if (at <= 0 || at == trimmed.length() - 1) {
            throw new IllegalArgumentException("Remote target must look like user@host[:port]: " + value);
        }
        String user = trimmed.substring(0, at);
        String hostPart = trimmed.substring(at + 1);
        int port = DEFAULT_PORT;
        int colon = hostPart.lastIndexOf(':');
        if (colon >= 0) {
            String portText = hostPart.substring(colon + 1);
            hostPart = hostPart.substring(0, colon);
            try {
                port = Integer.parseInt(portText);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port in remote target: " + value, e);
            }
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("Port out of range in remote target: " + value);
            }
        }
        if (hostPart.isBlank()) {
            throw new IllegalArgumentException("Remote target has no host: " + value);
        }
        return new RemoteHost(user, hostPart, port);
    }

    public String destination() {
        return user + "@" + host;
    }

    @Override
    public String toString() {
        return port == DEFAULT_PORT ? destination() : destination() + ":" + port;
    }
}
