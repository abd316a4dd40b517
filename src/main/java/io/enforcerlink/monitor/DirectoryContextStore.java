package io.enforcerlink.monitor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.stream.Stream;

/**
 * Read-only view over a context directory laid out as
 * {@code <root>/<contextId>/eventInfo.data}. Writing records is the owning
 * store's job; the monitor only lists and reads them.
 */
public final class DirectoryContextStore implements ContextStore {
    public static final String EVENT_INFO_FILE = "eventInfo.data";

    private final Path root;

    public DirectoryContextStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public BlockingQueue<String> walkStore() throws IOException {
        if (!Files.isDirectory(root)) {
            throw new NoSuchFileException(root.toString(), null, "context store root is not a directory");
        }
        List<String> names;
        try (Stream<Path> children = Files.list(root)) {
            names = children
                    .filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .toList();
        }
        LinkedBlockingQueue<String> queue = new LinkedBlockingQueue<>(names);
        queue.add(END_OF_WALK);
        return queue;
    }

    @Override
    public byte[] getContextInfo(String contextPath) throws IOException {
        String relative = contextPath == null ? "" : contextPath.trim();
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        if (relative.isEmpty()) {
            throw new IOException("context path is empty");
        }
        Path dir = root.resolve(relative).normalize();
        if (!dir.startsWith(root) || dir.equals(root)) {
            throw new IOException("context path escapes store root: " + contextPath);
        }
        return Files.readAllBytes(dir.resolve(EVENT_INFO_FILE));
    }
}
