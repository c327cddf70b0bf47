package me.golemcore.termagent.adapter.outbound.storage;

import me.golemcore.termagent.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String TEST_DIR = "test-dir";
    private static final String CONTENT_DEFAULT = "content";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        AgentProperties properties = new AgentProperties();
        properties.getStorage().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void initCreatesPlanAndReportDirectories() {
        assertTrue(Files.isDirectory(tempDir.resolve("plans")));
        assertTrue(Files.isDirectory(tempDir.resolve("reports")));
        assertEquals(tempDir.toAbsolutePath().normalize(), storageAdapter.getBasePath());
    }

    @Test
    void putAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, "test-file.txt", "Hello, World!").get();

        assertEquals("Hello, World!", storageAdapter.getText(TEST_DIR, "test-file.txt").get());
    }

    @Test
    void putTextAtomic_createsNestedDirectories() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, "nested/deeper/file.txt", CONTENT_DEFAULT).get();

        assertTrue(Files.isRegularFile(tempDir.resolve(TEST_DIR).resolve("nested/deeper/file.txt")));
    }

    @Test
    void getText_returnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(TEST_DIR, "missing.txt").get());
    }

    @Test
    void putTextAtomic_replacesContentAndLeavesNoTempFile() throws Exception {
        storageAdapter.putTextAtomic("reports", "s-1.json", "{\"v\":1}").get();
        storageAdapter.putTextAtomic("reports", "s-1.json", "{\"v\":2}").get();

        assertEquals("{\"v\":2}", storageAdapter.getText("reports", "s-1.json").get());
        assertFalse(Files.exists(tempDir.resolve("reports/s-1.json.tmp")));
    }

    @Test
    void pathTraversalIsBlocked() {
        ExecutionException error = assertThrows(ExecutionException.class,
                () -> storageAdapter.putTextAtomic(TEST_DIR, "../../escape.txt", CONTENT_DEFAULT).get());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }
}
