package io.enforcerlink.collector;

import io.enforcerlink.util.Hashing;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Aggregates flow observations. Records sharing a {@link #statsFlowHash}
 * fingerprint collapse into one entry whose count is the sum of theirs.
 */
public final class FlowCollector {
    private static final String SEPARATOR = "\u001f";

    private final ConcurrentHashMap<String, FlowRecord> flows = new ConcurrentHashMap<>();

    public void collectFlowEvent(FlowRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("flow record is required");
        }
        flows.merge(statsFlowHash(record), record, (existing, incoming) ->
                existing.withCount(existing.count() + incoming.count()));
    }

    public List<FlowRecord> flows() {
        return sorted(new ArrayList<>(flows.values()));
    }

    public List<FlowRecord> drain() {
        List<FlowRecord> out = new ArrayList<>();
        for (Map.Entry<String, FlowRecord> entry : flows.entrySet()) {
            FlowRecord removed = flows.remove(entry.getKey());
            if (removed != null) {
                out.add(removed);
            }
        }
        return sorted(out);
    }

    public Optional<FlowRecord> find(String flowHash) {
        return flowHash == null ? Optional.empty() : Optional.ofNullable(flows.get(flowHash));
    }

    public int size() {
        return flows.size();
    }

    public static String statsFlowHash(FlowRecord record) {
        String key = String.join(SEPARATOR,
                record.contextId(),
                record.sourceId(),
                record.destinationId(),
                record.sourceIp(),
                record.destinationIp(),
                Integer.toString(record.destinationPort()),
                record.action()
        );
        return Hashing.sha256Hex(key);
    }

    private static List<FlowRecord> sorted(List<FlowRecord> records) {
        records.sort(Comparator.comparing(FlowRecord::contextId)
                .thenComparing(FlowRecord::sourceId)
                .thenComparing(FlowRecord::destinationId)
                .thenComparingInt(FlowRecord::destinationPort));
        return records;
    }
}
