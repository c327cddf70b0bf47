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

package me.golemcore.termagent.adapter.outbound.execution;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.termagent.domain.exception.ExecutionBackendException;
import me.golemcore.termagent.domain.exception.UserInterruptException;
import me.golemcore.termagent.domain.model.CommandResult;
import me.golemcore.termagent.domain.model.ExecutionTarget;
import me.golemcore.termagent.domain.model.RemoteHost;
import me.golemcore.termagent.infrastructure.config.AgentProperties;
import me.golemcore.termagent.port.outbound.ExecutionBackendPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs commands through a local shell or over a multiplexed SSH connection.
 *
 * <p>
 * A remote session opens one master connection ({@code ssh -M}) with a control
 * socket; every later command reuses it, so authentication happens once. Exit
 * status 255 from ssh means the transport itself failed and is reported as a
 * backend failure rather than a command result.
 *
 * <p>
 * On timeout or interrupt the whole local process tree is killed. Remote
 * commands are additionally wrapped in {@code timeout} so they die on the host
 * even though only the local ssh client is killed.
 */
@Component
@Slf4j
public class ProcessExecutionAdapter implements ExecutionBackendPort {

    static final int SSH_TRANSPORT_FAILURE = 255;
    static final long REMOTE_TIMEOUT_GRACE_SECONDS = 2;
    private static final String TRUNCATED_MARKER = "\n[Output truncated...]";
    private static final long OUTPUT_DRAIN_SECONDS = 2;

    private final AgentProperties.ExecutionProperties settings;
    private final ExecutorService executor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "process-output");
        thread.setDaemon(true);
        return thread;
    });

    public ProcessExecutionAdapter(AgentProperties properties) {
        this.settings = properties.getExecution();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    @Override
    public CommandResult run(String command, Duration timeout, ExecutionTarget target) {
        List<String> argv = target.isRemote() ? remoteCommand(command, timeout, target) : localCommand(command);
        log.debug("[Exec] Running on {}: {}", target.describe(), command);
        CommandResult result = runProcess(argv, timeout);
        if (target.isRemote() && !result.timedOut() && result.exitCode() == SSH_TRANSPORT_FAILURE) {
            throw new ExecutionBackendException("Connection to " + target.describe() + " failed: "
                    + result.stderr().strip());
        }
        return result;
    }

    @Override
    public ExecutionTarget connect(RemoteHost host) {
        Path controlPath = controlSocketPath();
        List<String> argv = new ArrayList<>(List.of(settings.getSshBinary(), "-M", "-N", "-f",
                "-o", "ControlPath=" + controlPath,
                "-o", "ControlPersist=" + settings.getSshControlPersist(),
                "-o", "ConnectTimeout=" + settings.getSshConnectTimeoutSeconds(),
                "-p", String.valueOf(host.port()), host.destination()));
        log.info("[Exec] Opening SSH connection to {}", host);
        try {
            // Inherit the terminal so ssh can prompt for passwords or host keys.
            Process process = new ProcessBuilder(argv).inheritIO().start();
            boolean completed = process.waitFor(settings.getSshConnectTimeoutSeconds() * 4L, TimeUnit.SECONDS);
            if (!completed) {
                process.destroyForcibly();
                throw new ExecutionBackendException("Timed out connecting to " + host);
            }
            if (process.exitValue() != 0) {
                throw new ExecutionBackendException("Could not connect to " + host + " (ssh exit code "
                        + process.exitValue() + ")");
            }
        } catch (IOException e) {
            throw new ExecutionBackendException("Failed to start ssh: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UserInterruptException("Interrupted while connecting to " + host, e);
        }
        ExecutionTarget target = ExecutionTarget.remote(host, controlPath);
        CommandResult handshake = run("true", Duration.ofSeconds(settings.getSshConnectTimeoutSeconds()), target);
        if (!handshake.isSuccess()) {
            throw new ExecutionBackendException("Connection check failed for " + host);
        }
        log.info("[Exec] Connected to {}", host);
        return target;
    }

    @Override
    public void disconnect(ExecutionTarget target) {
        if (target == null || !target.isRemote()) {
            return;
        }
        List<String> argv = List.of(settings.getSshBinary(), "-O", "exit",
                "-o", "ControlPath=" + target.controlPath(), target.remoteHost().destination());
        try {
            CommandResult result = runProcess(argv, Duration.ofSeconds(settings.getSshConnectTimeoutSeconds()));
            log.info("[Exec] Closed SSH connection to {} (exit {})", target.describe(), result.exitCode());
        } catch (RuntimeException e) {
            log.warn("[Exec] Failed to close SSH connection to {}", target.describe(), e);
        }
    }

    List<String> localCommand(String command) {
        return List.of(settings.getShell(), "-c", command);
    }

    List<String> remoteCommand(String command, Duration timeout, ExecutionTarget target) {
        RemoteHost host = target.remoteHost();
        // Outlives the local timer slightly so the local timeout is what gets reported.
        long remoteSeconds = Math.max(1, (timeout.toMillis() + 999) / 1000) + REMOTE_TIMEOUT_GRACE_SECONDS;
        return List.of(settings.getSshBinary(),
                "-o", "ControlPath=" + target.controlPath(),
                "-o", "ControlMaster=auto",
                "-o", "ControlPersist=" + settings.getSshControlPersist(),
                "-o", "BatchMode=yes",
                "-p", String.valueOf(host.port()),
                host.destination(), "--",
                "timeout -s KILL " + remoteSeconds + " " + settings.getShell() + " -c " + quote(command));
    }

    static String quote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }

    private CommandResult runProcess(List<String> argv, Duration timeout) {
        long start = System.nanoTime();
        Process process;
        try {
            process = new ProcessBuilder(argv).redirectInput(ProcessBuilder.Redirect.PIPE).start();
            process.getOutputStream().close();
        } catch (IOException e) {
            throw new ExecutionBackendException("Failed to start process: " + e.getMessage(), e);
        }

        Future<String> stdout = executor.submit(() -> drain(process.getInputStream()));
        Future<String> stderr = executor.submit(() -> drain(process.getErrorStream()));
        try {
            boolean completed = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!completed) {
                terminate(process);
                log.warn("[Exec] Command timed out after {}s", timeout.toSeconds());
                return CommandResult.timeout(collect(stdout), collect(stderr), elapsed(start));
            }
            return new CommandResult(process.exitValue(), collect(stdout), collect(stderr), false, elapsed(start));
        } catch (InterruptedException e) {
            terminate(process);
            Thread.currentThread().interrupt();
            throw new UserInterruptException("Command interrupted", e);
        }
    }

    /**
     * Kills descendants first; once the parent is gone they are reparented and
     * no longer reachable from it.
     */
    static void terminate(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private String drain(InputStream stream) throws IOException {
        byte[] bytes = stream.readAllBytes();
        return truncate(new String(bytes, StandardCharsets.UTF_8));
    }

    private String collect(Future<String> future) throws InterruptedException {
        try {
            return future.get(OUTPUT_DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return "[Output read timeout]";
        } catch (ExecutionException e) {
            return "[Error reading output: " + e.getCause().getMessage() + "]";
        }
    }

    String truncate(String output) {
        int max = settings.getMaxOutputChars();
        if (output.length() <= max) {
            return output;
        }
        return output.substring(0, max) + TRUNCATED_MARKER;
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static Path controlSocketPath() {
        try {
            Path dir = Files.createTempDirectory("term-agent-ssh");
            // Unix socket paths are limited to about 100 characters.
            return dir.resolve(UUID.randomUUID().toString().substring(0, 8) + ".sock");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create SSH control directory", e);
        }
    }
}
