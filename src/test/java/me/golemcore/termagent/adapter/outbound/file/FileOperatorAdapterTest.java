package me.golemcore.termagent.adapter.outbound.file;

import me.golemcore.termagent.domain.exception.FileOperationException;
import me.golemcore.termagent.domain.model.CommandResult;
import me.golemcore.termagent.domain.model.ExecutionTarget;
import me.golemcore.termagent.domain.model.RemoteHost;
import me.golemcore.termagent.domain.model.ToolInvocation.EditAction;
import me.golemcore.termagent.infrastructure.config.AgentProperties;
import me.golemcore.termagent.port.outbound.ExecutionBackendPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class FileOperatorAdapterTest {

    private static final Instant FIXED_INSTANT = Instant.parse("2026-02-11T10:15:30Z");
    private static final ExecutionTarget LOCAL = ExecutionTarget.local();

    @TempDir
    Path tempDir;

    private ExecutionBackendPort executionBackend;
    private FileOperatorAdapter adapter;

    @BeforeEach
    void setUp() {
        executionBackend = mock(ExecutionBackendPort.class);
        adapter = new FileOperatorAdapter(executionBackend, new AgentProperties(),
                Clock.fixed(FIXED_INSTANT, ZoneOffset.UTC));
    }

    private String path(String name) {
        return tempDir.resolve(name).toString();
    }

    // ==================== Local ====================

    @Test
    void shouldWriteCreatingParentsAndReadBack() throws IOException {
        // Arrange
        String file = path("conf/app.conf");

        // Act
        adapter.write(LOCAL, file, "port=80\nhost=localhost\n");
        String read = adapter.read(LOCAL, file, null, null);

        // Assert
        assertEquals("port=80\nhost=localhost\n", Files.readString(Path.of(file)));
        assertTrue(read.startsWith("File " + file + " (2 line(s)):\n"));
        verifyNoInteractions(executionBackend);
    }

    @Test
    void shouldReadLineRange() throws IOException {
        // Arrange
        Files.writeString(tempDir.resolve("lines.txt"), "one\ntwo\nthree\n");

        // Act
        String read = adapter.read(LOCAL, path("lines.txt"), 2, 3);

        // Assert
        assertTrue(read.contains("(lines 2-3 of 3)"));
        assertTrue(read.endsWith("two\nthree\n"));
    }

    @Test
    void shouldFailReadingMissingFile() {
        assertThrows(FileOperationException.class, () -> adapter.read(LOCAL, path("nope.txt"), null, null));
    }

    @Test
    void shouldEditFileInPlace() throws IOException {
        // Arrange
        Files.writeString(tempDir.resolve("app.conf"), "port=80\nhost=localhost\n");

        // Act
        String result = adapter.edit(LOCAL, path("app.conf"), EditAction.REPLACE, "port=80", "port=8080", null);

        // Assert
        assertEquals("port=8080\nhost=localhost\n", Files.readString(tempDir.resolve("app.conf")));
        assertTrue(result.contains("1 line(s)"));
    }

    @Test
    void shouldRefuseCopyOverExistingDestinationWithoutOverwrite() throws IOException {
        // Arrange
        Files.writeString(tempDir.resolve("a.txt"), "new");
        Files.writeString(tempDir.resolve("b.txt"), "old");

        // Act + Assert
        assertThrows(FileOperationException.class, () -> adapter.copy(LOCAL, path("a.txt"), path("b.txt"), false));
        adapter.copy(LOCAL, path("a.txt"), path("b.txt"), true);
        assertEquals("new", Files.readString(tempDir.resolve("b.txt")));
    }

    @Test
    void shouldDeleteWithTimestampedBackup() throws IOException {
        // Arrange
        Files.writeString(tempDir.resolve("old.log"), "data");

        // Act
        String result = adapter.delete(LOCAL, path("old.log"), true);

        // Assert
        assertFalse(Files.exists(tempDir.resolve("old.log")));
        Path backup = tempDir.resolve("old.log.backup_20260211_101530");
        assertEquals("data", Files.readString(backup));
        assertTrue(result.contains("backup"));
    }

    @Test
    void shouldDeleteDirectoryRecursively() throws IOException {
        // Arrange
        Files.createDirectories(tempDir.resolve("build/classes"));
        Files.writeString(tempDir.resolve("build/classes/A.class"), "x");

        // Act
        adapter.delete(LOCAL, path("build"), false);

        // Assert
        assertFalse(Files.exists(tempDir.resolve("build")));
    }

    @Test
    void shouldListDirectoriesFirstWithSizesAndPattern() throws IOException {
        // Arrange
        Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(tempDir.resolve("readme.md"), "12345");
        Files.writeString(tempDir.resolve("notes.txt"), "1");

        // Act
        String all = adapter.list(LOCAL, tempDir.toString(), false, null);
        String markdown = adapter.list(LOCAL, tempDir.toString(), false, "*.md");

        // Assert
        String[] lines = all.split("\n");
        assertEquals(4, lines.length);
        assertEquals("src/", lines[1]);
        assertTrue(all.contains("readme.md (5 bytes)"));
        assertTrue(markdown.contains("(1 entries)"));
        assertFalse(markdown.contains("notes.txt"));
    }

    @Test
    void shouldFailListingMissingDirectory() {
        assertThrows(FileOperationException.class, () -> adapter.list(LOCAL, path("missing"), false, null));
    }

    // ==================== Remote ====================

    @Test
    void shouldWriteRemoteFileThroughBase64Transfer() {
        // Arrange
        ExecutionTarget remote = ExecutionTarget.remote(RemoteHost.parse("deploy@web1"), tempDir.resolve("ctl"));
        when(executionBackend.run(anyString(), any(Duration.class), any(ExecutionTarget.class)))
                .thenReturn(new CommandResult(0, "", "", false, Duration.ofMillis(10)));

        // Act
        adapter.write(remote, "/etc/app's.conf", "port=80\n");

        // Assert
        ArgumentCaptor<String> script = ArgumentCaptor.forClass(String.class);
        verify(executionBackend).run(script.capture(), any(Duration.class), any(ExecutionTarget.class));
        String encoded = Base64.getEncoder().encodeToString("port=80\n".getBytes(StandardCharsets.UTF_8));
        assertTrue(script.getValue().contains(encoded));
        assertTrue(script.getValue().contains("'/etc/app'\"'\"'s.conf'"));
    }

    @Test
    void shouldDecodeRemoteRead() {
        // Arrange
        ExecutionTarget remote = ExecutionTarget.remote(RemoteHost.parse("deploy@web1"), tempDir.resolve("ctl"));
        String encoded = Base64.getEncoder().encodeToString("a\nb\n".getBytes(StandardCharsets.UTF_8));
        when(executionBackend.run(anyString(), any(Duration.class), any(ExecutionTarget.class)))
                .thenReturn(new CommandResult(0, encoded + "\n", "", false, Duration.ofMillis(10)));

        // Act
        String read = adapter.read(remote, "/srv/x.txt", null, null);

        // Assert
        assertEquals("File /srv/x.txt (2 line(s)):\na\nb\n", read);
    }

    @Test
    void shouldMapRemoteNotFoundExit() {
        // Arrange
        ExecutionTarget remote = ExecutionTarget.remote(RemoteHost.parse("deploy@web1"), tempDir.resolve("ctl"));
        when(executionBackend.run(anyString(), any(Duration.class), any(ExecutionTarget.class)))
                .thenReturn(new CommandResult(3, "", "", false, Duration.ofMillis(10)));

        // Act
        FileOperationException error = assertThrows(FileOperationException.class,
                () -> adapter.delete(remote, "/srv/missing", false));

        // Assert
        assertTrue(error.getMessage().contains("path does not exist"));
    }
}
