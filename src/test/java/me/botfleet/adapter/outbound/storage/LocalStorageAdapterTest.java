package me.botfleet.adapter.outbound.storage;

import me.botfleet.infrastructure.config.FleetProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String TEST_DIR = "fleet";
    private static final String FILE_1 = "fleet-config.json";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        FleetProperties properties = new FleetProperties();
        properties.getStorage().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void init_createsWorkspaceLayout() {
        assertTrue(Files.isDirectory(tempDir.resolve("fleet")));
        assertTrue(Files.isDirectory(tempDir.resolve("instances")));
    }

    @Test
    void putTextAtomicAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, FILE_1, "{\"a\":1}", false).get();

        assertEquals("{\"a\":1}", storageAdapter.getText(TEST_DIR, FILE_1).get());
        assertFalse(Files.exists(tempDir.resolve(TEST_DIR).resolve(FILE_1 + ".tmp")));
    }

    @Test
    void putTextAtomic_keepsPreviousVersionAsBackup() throws Exception {
        storageAdapter.putTextAtomic(TEST_DIR, FILE_1, "v1", true).get();
        storageAdapter.putTextAtomic(TEST_DIR, FILE_1, "v2", true).get();

        assertEquals("v2", storageAdapter.getText(TEST_DIR, FILE_1).get());
        Path backup = tempDir.resolve(TEST_DIR).resolve(FILE_1 + ".bak");
        assertEquals("v1", Files.readString(backup, StandardCharsets.UTF_8));
    }

    @Test
    void putTextAtomic_withoutBackupLeavesNoBakFile() throws Exception {
        storageAdapter.putTextAtomic(TEST_DIR, FILE_1, "v1", false).get();
        storageAdapter.putTextAtomic(TEST_DIR, FILE_1, "v2", false).get();

        assertFalse(Files.exists(tempDir.resolve(TEST_DIR).resolve(FILE_1 + ".bak")));
    }

    @Test
    void getText_returnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(TEST_DIR, "missing.json").get());
    }

    @Test
    void exists_reflectsFileState() throws ExecutionException, InterruptedException {
        assertFalse(storageAdapter.exists(TEST_DIR, FILE_1).get());

        storageAdapter.putTextAtomic(TEST_DIR, FILE_1, "x", false).get();

        assertTrue(storageAdapter.exists(TEST_DIR, FILE_1).get());
    }

    @Test
    void ensureDirectory_createsNestedDirectories() throws ExecutionException, InterruptedException {
        storageAdapter.ensureDirectory("instances/abc").get();

        assertTrue(Files.isDirectory(tempDir.resolve("instances").resolve("abc")));
    }

    @Test
    void resolveDirectory_staysInsideWorkspace() {
        Path resolved = storageAdapter.resolveDirectory("instances");

        assertEquals(tempDir.toAbsolutePath().normalize().resolve("instances"), resolved);
    }

    @Test
    void pathTraversalIsBlocked() {
        assertThrows(IllegalArgumentException.class, () -> storageAdapter.resolveDirectory("../outside"));
        ExecutionException error = assertThrows(ExecutionException.class,
                () -> storageAdapter.getText("fleet", "../../etc/passwd").get());
        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }
}
