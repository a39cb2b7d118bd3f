package me.botfleet.adapter.outbound.knowledge;

import me.botfleet.port.outbound.KnowledgeStorePort.KnowledgeHandle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalKnowledgeStoreAdapterTest {

    @TempDir
    Path tempDir;

    private final LocalKnowledgeStoreAdapter adapter = new LocalKnowledgeStoreAdapter();

    @Test
    void shouldCreateStoreLayoutOnOpen() throws IOException {
        Path root = tempDir.resolve("instances").resolve("abc");

        try (KnowledgeHandle handle = adapter.open(root)) {
            assertTrue(handle.isOpen());
            assertEquals(root.toAbsolutePath().normalize(), handle.path());
            assertTrue(Files.isDirectory(root.resolve(LocalKnowledgeStoreAdapter.FACTS_DIR)));
            assertTrue(Files.exists(root.resolve(LocalKnowledgeStoreAdapter.LOCK_FILE)));
        }
    }

    @Test
    void shouldRefuseSecondHandleOnSameDirectory() throws IOException {
        Path root = tempDir.resolve("shared");

        try (KnowledgeHandle first = adapter.open(root)) {
            IOException error = assertThrows(IOException.class, () -> adapter.open(root));
            assertTrue(error.getMessage().contains("already open"));
            assertTrue(first.isOpen());
        }
    }

    @Test
    void shouldAllowReopenAfterClose() throws IOException {
        Path root = tempDir.resolve("reopen");

        KnowledgeHandle first = adapter.open(root);
        first.close();
        assertFalse(first.isOpen());

        try (KnowledgeHandle second = adapter.open(root)) {
            assertTrue(second.isOpen());
        }
    }

    @Test
    void shouldKeepDistinctDirectoriesIndependent() throws IOException {
        try (KnowledgeHandle a = adapter.open(tempDir.resolve("a"));
                KnowledgeHandle b = adapter.open(tempDir.resolve("b"))) {
            assertTrue(a.isOpen());
            assertTrue(b.isOpen());
        }
    }

    @Test
    void closeShouldBeIdempotent() throws IOException {
        KnowledgeHandle handle = adapter.open(tempDir.resolve("twice"));

        handle.close();

        assertDoesNotThrow(handle::close);
    }
}
