package io.enforcerlink.monitor;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Processor for {@link UnitType#LINUX_PROCESS} units. Create and start run
 * metadata extraction before the unit handler is consulted; the remaining
 * transitions only need the unit id.
 */
public final class ProcessEventProcessor implements EventProcessor {
    private final UnitHandler unitHandler;
    private final MetadataExtractor extractor;
    private final ConcurrentMap<String, UnitRuntime> tracked;

    public ProcessEventProcessor(UnitHandler unitHandler) {
        this(unitHandler, new DefaultMetadataExtractor());
    }

    public ProcessEventProcessor(UnitHandler unitHandler, MetadataExtractor extractor) {
        this.unitHandler = Objects.requireNonNull(unitHandler, "unitHandler");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.tracked = new ConcurrentHashMap<>();
    }

    @Override
    public void create(EventInfo event) throws Exception {
        UnitRuntime runtime = extractor.extract(event);
        String unitId = event.unitId();
        if (tracked.putIfAbsent(unitId, runtime) != null) {
            throw new UnitAlreadyTrackedException(unitId);
        }
        try {
            unitHandler.createUnitRuntime(unitId, runtime);
            unitHandler.handleUnitEvent(unitId, EventType.CREATE);
        } catch (Exception e) {
            tracked.remove(unitId, runtime);
            throw e;
        }
    }

    // A start for a unit never seen (monitor restarted mid-life) registers it first.
    @Override
    public void start(EventInfo event) throws Exception {
        UnitRuntime runtime = extractor.extract(event);
        String unitId = event.unitId();
        if (tracked.putIfAbsent(unitId, runtime) != null) {
            unitHandler.handleUnitEvent(unitId, EventType.START);
            return;
        }
        try {
            unitHandler.createUnitRuntime(unitId, runtime);
            unitHandler.handleUnitEvent(unitId, EventType.START);
        } catch (Exception e) {
            tracked.remove(unitId, runtime);
            throw e;
        }
    }

    @Override
    public void stop(EventInfo event) throws Exception {
        unitHandler.handleUnitEvent(requireUnitId(event), EventType.STOP);
    }

    @Override
    public void destroy(EventInfo event) throws Exception {
        String unitId = requireUnitId(event);
        unitHandler.handleUnitEvent(unitId, EventType.DESTROY);
        tracked.remove(unitId);
    }

    @Override
    public void pause(EventInfo event) throws Exception {
        unitHandler.handleUnitEvent(requireUnitId(event), EventType.PAUSE);
    }

    @Override
    public void unpause(EventInfo event) throws Exception {
        unitHandler.handleUnitEvent(requireUnitId(event), EventType.UNPAUSE);
    }

    public Set<String> trackedUnits() {
        return Set.copyOf(tracked.keySet());
    }

    public Optional<UnitRuntime> runtime(String unitId) {
        return unitId == null ? Optional.empty() : Optional.ofNullable(tracked.get(unitId));
    }

    private static String requireUnitId(EventInfo event) {
        if (event.unitId() == null || event.unitId().isBlank()) {
            throw new MetadataException("event unit id cannot be empty");
        }
        return event.unitId();
    }
}
