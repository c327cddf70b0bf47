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

package me.golemcore.termagent.adapter.outbound.file;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.termagent.domain.exception.FileOperationException;
import me.golemcore.termagent.domain.model.CommandResult;
import me.golemcore.termagent.domain.model.ExecutionTarget;
import me.golemcore.termagent.domain.model.ToolInvocation.EditAction;
import me.golemcore.termagent.infrastructure.config.AgentProperties;
import me.golemcore.termagent.port.outbound.ExecutionBackendPort;
import me.golemcore.termagent.port.outbound.FileOperatorPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * File operations against the local filesystem or, for remote targets, through
 * shell commands over the session's SSH connection.
 *
 * <p>
 * Relative paths resolve against the working directory of the process (local)
 * or the login directory (remote). Remote writes ship content base64-encoded so
 * no quoting of the payload is needed.
 */
@Component
@Slf4j
public class FileOperatorAdapter implements FileOperatorPort {

    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int MAX_LIST_ENTRIES = 500;
    private static final int NOT_FOUND_EXIT = 3;
    private static final int EXISTS_EXIT = 4;

    private final ExecutionBackendPort executionBackend;
    private final AgentProperties.ExecutionProperties settings;
    private final Clock clock;

    public FileOperatorAdapter(ExecutionBackendPort executionBackend, AgentProperties properties, Clock clock) {
        this.executionBackend = executionBackend;
        this.settings = properties.getExecution();
        this.clock = clock;
    }

    // ==================== Read / write ====================

    @Override
    public String read(ExecutionTarget target, String path, Integer startLine, Integer endLine) {
        String content = target.isRemote() ? readRemote(target, path) : readLocal(path);
        String selected = LineEditor.slice(content, startLine, endLine);
        int total = LineEditor.countLines(content);
        String range = startLine == null && endLine == null
                ? total + " line(s)"
                : "lines " + (startLine == null ? 1 : startLine) + "-" + (endLine == null ? total : endLine)
                        + " of " + total;
        return "File " + path + " (" + range + "):\n" + selected;
    }

    @Override
    public String write(ExecutionTarget target, String path, String content) {
        if (target.isRemote()) {
            writeRemote(target, path, content);
        } else {
            writeLocal(path, content);
        }
        log.info("[Files] Wrote {} ({} chars) on {}", path, content.length(), target.describe());
        return "Wrote " + content.length() + " characters to " + path;
    }

    @Override
    public String edit(ExecutionTarget target, String path, EditAction action, String search, String replace,
            String line) {
        String original = target.isRemote() ? readRemote(target, path) : readLocal(path);
        LineEditor.Edit edit = LineEditor.apply(original, action, search, replace, line);
        if (target.isRemote()) {
            writeRemote(target, path, edit.content());
        } else {
            writeLocal(path, edit.content());
        }
        log.info("[Files] Edited {} with {} ({} line(s))", path, action.wireName(), edit.matchedLines());
        return "Applied " + action.wireName() + " to " + edit.matchedLines() + " line(s) in " + path;
    }

    // ==================== Copy / delete ====================

    @Override
    public String copy(ExecutionTarget target, String source, String destination, boolean overwrite) {
        if (target.isRemote()) {
            String script = "[ -e " + quote(source) + " ] || exit " + NOT_FOUND_EXIT + "; "
                    + (overwrite ? "" : "[ -e " + quote(destination) + " ] && exit " + EXISTS_EXIT + "; ")
                    + "cp -r -- " + quote(source) + " " + quote(destination);
            runRemote(target, script, "copy " + source);
        } else {
            copyLocal(source, destination, overwrite);
        }
        return "Copied " + source + " to " + destination;
    }

    @Override
    public String delete(ExecutionTarget target, String path, boolean backup) {
        String backupPath = backup ? path + ".backup_" + LocalDateTime.now(clock).format(BACKUP_STAMP) : null;
        if (target.isRemote()) {
            StringBuilder script = new StringBuilder("[ -e " + quote(path) + " ] || exit " + NOT_FOUND_EXIT + "; ");
            if (backupPath != null) {
                script.append("cp -r -- ").append(quote(path)).append(' ').append(quote(backupPath)).append(" && ");
            }
            script.append("rm -rf -- ").append(quote(path));
            runRemote(target, script.toString(), "delete " + path);
        } else {
            deleteLocal(path, backupPath);
        }
        log.info("[Files] Deleted {} on {}", path, target.describe());
        return backupPath == null ? "Deleted " + path : "Deleted " + path + " (backup: " + backupPath + ")";
    }

    // ==================== Listing ====================

    @Override
    public String list(ExecutionTarget target, String path, boolean recursive, String pattern) {
        List<String> entries = target.isRemote()
                ? listRemote(target, path, recursive, pattern)
                : listLocal(path, recursive, pattern);
        StringBuilder sb = new StringBuilder();
        sb.append("Directory ").append(path).append(" (").append(entries.size()).append(" entries)");
        entries.stream().limit(MAX_LIST_ENTRIES).forEach(entry -> sb.append('\n').append(entry));
        if (entries.size() > MAX_LIST_ENTRIES) {
            sb.append("\n... ").append(entries.size() - MAX_LIST_ENTRIES).append(" more");
        }
        return sb.toString();
    }

    private List<String> listLocal(String path, boolean recursive, String pattern) {
        Path dir = Paths.get(path);
        if (!Files.isDirectory(dir)) {
            throw new FileOperationException(Files.exists(dir)
                    ? "'" + path + "' is not a directory"
                    : "Directory '" + path + "' does not exist");
        }
        PathMatcher matcher = pattern == null || pattern.isBlank()
                ? null
                : FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        try (Stream<Path> stream = recursive ? Files.walk(dir) : Files.list(dir)) {
            return stream
                    .filter(p -> !p.equals(dir))
                    .filter(p -> matcher == null || matcher.matches(p.getFileName()))
                    .sorted(Comparator.comparing((Path p) -> !Files.isDirectory(p))
                            .thenComparing(p -> dir.relativize(p).toString().toLowerCase()))
                    .map(p -> describeEntry(dir, p))
                    .toList();
        } catch (IOException e) {
            throw new FileOperationException("Failed to list '" + path + "': " + e.getMessage(), e);
        }
    }

    private static String describeEntry(Path root, Path entry) {
        String name = root.relativize(entry).toString();
        if (Files.isDirectory(entry)) {
            return name + "/";
        }
        try {
            return name + " (" + Files.size(entry) + " bytes)";
        } catch (IOException e) {
            log.debug("[Files] Cannot read size of {}", entry, e);
            return name;
        }
    }

    private List<String> listRemote(ExecutionTarget target, String path, boolean recursive, String pattern) {
        StringBuilder script = new StringBuilder("[ -d " + quote(path) + " ] || exit " + NOT_FOUND_EXIT + "; ");
        script.append("cd ").append(quote(path)).append(" && find . -mindepth 1");
        if (!recursive) {
            script.append(" -maxdepth 1");
        }
        if (pattern != null && !pattern.isBlank()) {
            script.append(" -name ").append(quote(pattern));
        }
        script.append(" \\( -type d -printf '%P/\\n' \\) -o \\( -printf '%P (%s bytes)\\n' \\) | sort");
        String output = runRemote(target, script.toString(), "list " + path);
        List<String> entries = new ArrayList<>();
        for (String entry : output.split("\n")) {
            if (!entry.isBlank()) {
                entries.add(entry.strip());
            }
        }
        return entries;
    }

    // ==================== Local backend ====================

    private static String readLocal(String path) {
        Path file = Paths.get(path);
        if (!Files.isRegularFile(file)) {
            throw new FileOperationException("File '" + path + "' does not exist");
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FileOperationException("Failed to read '" + path + "': " + e.getMessage(), e);
        }
    }

    private static void writeLocal(String path, String content) {
        Path file = Paths.get(path).toAbsolutePath();
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                log.warn("[Files] Failed to cleanup temp file: {}", tmp, cleanup);
            }
            throw new FileOperationException("Failed to write '" + path + "': " + e.getMessage(), e);
        }
    }

    private static void copyLocal(String source, String destination, boolean overwrite) {
        Path src = Paths.get(source);
        Path dst = Paths.get(destination);
        if (!Files.exists(src)) {
            throw new FileOperationException("Source '" + source + "' does not exist");
        }
        if (Files.exists(dst) && !overwrite) {
            throw new FileOperationException("Destination '" + destination + "' exists; set overwrite to replace it");
        }
        try {
            if (Files.isDirectory(src)) {
                copyTree(src, dst);
            } else {
                Path parent = dst.toAbsolutePath().getParent();
                Files.createDirectories(parent);
                Files.copy(src, dst, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            }
        } catch (FileAlreadyExistsException | DirectoryNotEmptyException e) {
            throw new FileOperationException("Cannot overwrite '" + destination + "': " + e.getMessage(), e);
        } catch (IOException e) {
            throw new FileOperationException("Failed to copy '" + source + "': " + e.getMessage(), e);
        }
    }

    private static void copyTree(Path src, Path dst) throws IOException {
        Files.walkFileTree(src, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Files.createDirectories(dst.resolve(src.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.copy(file, dst.resolve(src.relativize(file).toString()), StandardCopyOption.REPLACE_EXISTING);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private static void deleteLocal(String path, String backupPath) {
        Path target = Paths.get(path);
        if (!Files.exists(target)) {
            throw new FileOperationException("'" + path + "' does not exist");
        }
        try {
            if (backupPath != null) {
                if (Files.isDirectory(target)) {
                    copyTree(target, Paths.get(backupPath));
                } else {
                    Files.copy(target, Paths.get(backupPath), StandardCopyOption.COPY_ATTRIBUTES);
                }
            }
            if (Files.isDirectory(target)) {
                try (Stream<Path> walk = Files.walk(target)) {
                    for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                        Files.delete(p);
                    }
                }
            } else {
                Files.delete(target);
            }
        } catch (NoSuchFileException e) {
            throw new FileOperationException("'" + path + "' disappeared during delete", e);
        } catch (IOException e) {
            throw new FileOperationException("Failed to delete '" + path + "': " + e.getMessage(), e);
        }
    }

    // ==================== Remote backend ====================

    private String readRemote(ExecutionTarget target, String path) {
        String script = "[ -f " + quote(path) + " ] || exit " + NOT_FOUND_EXIT + "; base64 < " + quote(path);
        String encoded = runRemote(target, script, "read " + path);
        try {
            return new String(Base64.getMimeDecoder().decode(encoded.strip()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new FileOperationException("Unreadable content from remote file '" + path + "'", e);
        }
    }

    private void writeRemote(ExecutionTarget target, String path, String content) {
        String encoded = Base64.getEncoder().encodeToString(content.getBytes(StandardCharsets.UTF_8));
        String script = "mkdir -p \"$(dirname " + quote(path) + ")\" && printf '%s' '" + encoded
                + "' | base64 -d > " + quote(path);
        runRemote(target, script, "write " + path);
    }

    private String runRemote(ExecutionTarget target, String script, String operation) {
        CommandResult result = executionBackend.run(script,
                Duration.ofSeconds(settings.getRemoteTimeoutSeconds()), target);
        if (result.timedOut()) {
            throw new FileOperationException("Remote " + operation + " timed out");
        }
        if (result.exitCode() == NOT_FOUND_EXIT) {
            throw new FileOperationException("Remote " + operation + " failed: path does not exist");
        }
        if (result.exitCode() == EXISTS_EXIT) {
            throw new FileOperationException("Remote " + operation
                    + " failed: destination exists; set overwrite to replace it");
        }
        if (!result.isSuccess()) {
            throw new FileOperationException("Remote " + operation + " failed (exit " + result.exitCode() + "): "
                    + result.stderr().strip());
        }
        return result.stdout();
    }

    static String quote(String value) {
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }
}
