package io.enforcerlink.monitor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

final class RecordingProcessor implements EventProcessor {
    private final List<Call> calls = new ArrayList<>();
    private final Map<EventType, Exception> failures = new HashMap<>();

    RecordingProcessor failOn(EventType type, Exception failure) {
        failures.put(type, failure);
        return this;
    }

    synchronized List<Call> calls() {
        return List.copyOf(calls);
    }

    @Override
    public void create(EventInfo event) throws Exception {
        record(EventType.CREATE, event);
    }

    @Override
    public void start(EventInfo event) throws Exception {
        record(EventType.START, event);
    }

    @Override
    public void stop(EventInfo event) throws Exception {
        record(EventType.STOP, event);
    }

    @Override
    public void destroy(EventInfo event) throws Exception {
        record(EventType.DESTROY, event);
    }

    private void record(EventType type, EventInfo event) throws Exception {
        synchronized (this) {
            calls.add(new Call(type, event));
        }
        Exception failure = failures.get(type);
        if (failure != null) {
            throw failure;
        }
    }

    record Call(EventType type, EventInfo event) {
    }
}
