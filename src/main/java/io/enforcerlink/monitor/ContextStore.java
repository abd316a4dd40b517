package io.enforcerlink.monitor;

import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Read side of the persistent record of known units.
 *
 * <p>{@link #walkStore()} yields context path fragments and then
 * {@link #END_OF_WALK}; producers may fill the queue asynchronously.
 * {@link #getContextInfo(String)} returns the persisted event bytes for
 * {@code "/" + fragment}.
 */
public interface ContextStore {
    String END_OF_WALK = "";

    BlockingQueue<String> walkStore() throws IOException;

    byte[] getContextInfo(String contextPath) throws IOException;

    static ContextStore empty() {
        return new ContextStore() {
            @Override
            public BlockingQueue<String> walkStore() {
                LinkedBlockingQueue<String> queue = new LinkedBlockingQueue<>();
                queue.add(END_OF_WALK);
                return queue;
            }

            @Override
            public byte[] getContextInfo(String contextPath) throws IOException {
                throw new IOException("no context stored at " + contextPath);
            }
        };
    }
}
