package io.enforcerlink.rpc;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Live sessions keyed by context id, in first-connect order. Every access
 * goes through this object's monitor.
 */
public final class ClientRegistry {
    private final Map<String, Session> sessions = new LinkedHashMap<>();

    public synchronized boolean contains(String contextId) {
        return sessions.containsKey(contextId);
    }

    public synchronized void add(Session session) {
        if (sessions.containsKey(session.contextId())) {
            throw new IllegalStateException("session already exists for context: " + session.contextId());
        }
        sessions.put(session.contextId(), session);
    }

    public synchronized Session get(String contextId) {
        Session session = sessions.get(contextId);
        if (session == null) {
            throw new UnknownContextException(contextId);
        }
        return session;
    }

    public synchronized Optional<Session> remove(String contextId) {
        return Optional.ofNullable(sessions.remove(contextId));
    }

    public synchronized List<Session> removeAll() {
        List<Session> out = new ArrayList<>(sessions.values());
        sessions.clear();
        return out;
    }

    public synchronized List<String> contextIds() {
        return List.copyOf(sessions.keySet());
    }

    public synchronized int size() {
        return sessions.size();
    }
}
