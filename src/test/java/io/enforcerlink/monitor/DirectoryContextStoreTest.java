package io.enforcerlink.monitor;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.stream.Stream;

final class DirectoryContextStoreTest {

    @Test
    void walksContextDirectoriesInOrderThenEndsWithSentinel() throws Exception {
        Path root = Files.createTempDirectory("enforcerlink-store-");
        try {
            writeRecord(root, "ctx-b", "{}");
            writeRecord(root, "ctx-a", "{}");
            Files.writeString(root.resolve("stray.txt"), "ignored");

            BlockingQueue<String> walk = new DirectoryContextStore(root).walkStore();
            List<String> seen = new ArrayList<>();
            walk.drainTo(seen);

            Assertions.assertEquals(List.of("ctx-a", "ctx-b", ContextStore.END_OF_WALK), seen);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void readsRecordByLeadingSlashPath() throws Exception {
        Path root = Files.createTempDirectory("enforcerlink-store-");
        try {
            writeRecord(root, "ctx-a", "{\"PUID\":\"u1\"}");
            DirectoryContextStore store = new DirectoryContextStore(root);

            byte[] raw = store.getContextInfo("/ctx-a");

            Assertions.assertEquals("{\"PUID\":\"u1\"}", new String(raw, StandardCharsets.UTF_8));
            Assertions.assertThrows(NoSuchFileException.class, () -> store.getContextInfo("/ctx-missing"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void refusesPathsOutsideRoot() throws Exception {
        Path root = Files.createTempDirectory("enforcerlink-store-");
        try {
            DirectoryContextStore store = new DirectoryContextStore(root);

            Assertions.assertThrows(IOException.class, () -> store.getContextInfo("/../etc"));
            Assertions.assertThrows(IOException.class, () -> store.getContextInfo("/"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingRootFailsWalk() {
        DirectoryContextStore store = new DirectoryContextStore(Path.of("does-not-exist-" + System.nanoTime()));
        Assertions.assertThrows(NoSuchFileException.class, store::walkStore);
    }

    private static void writeRecord(Path root, String contextId, String json) throws IOException {
        Path dir = Files.createDirectories(root.resolve(contextId));
        Files.writeString(dir.resolve(DirectoryContextStore.EVENT_INFO_FILE), json, StandardCharsets.UTF_8);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
