package io.enforcerlink.monitor;

import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes lifecycle events to the processor registered for their unit type.
 * A unit type gets exactly one processor for the dispatcher's lifetime.
 */
public final class EventDispatcher {
    private final Map<UnitType, EventProcessor> processors = new ConcurrentHashMap<>();

    public void register(UnitType unitType, EventProcessor processor) {
        if (unitType == null) {
            throw new IllegalArgumentException("unit type is required");
        }
        if (processor == null) {
            throw new IllegalArgumentException("processor is required for unit type " + unitType);
        }
        if (processors.putIfAbsent(unitType, processor) != null) {
            throw new IllegalStateException("processor already registered for unit type: " + unitType);
        }
    }

    public Optional<EventProcessor> processorFor(UnitType unitType) {
        return unitType == null ? Optional.empty() : Optional.ofNullable(processors.get(unitType));
    }

    public Set<UnitType> registeredTypes() {
        Set<UnitType> out = EnumSet.noneOf(UnitType.class);
        out.addAll(processors.keySet());
        return out;
    }

    // Event type is checked first so a bad type is reported even with no processors registered.
    public EventType validate(EventInfo event) {
        if (event == null) {
            throw new EventValidationException("event is required");
        }
        EventType type = EventType.fromWire(event.eventType())
                .orElseThrow(() -> new UnknownEventTypeException(event.eventType()));
        if (processorFor(event.unitType()).isEmpty()) {
            throw new NoProcessorException(event.unitType());
        }
        return type;
    }

    public void dispatch(EventInfo event) throws Exception {
        EventType type = validate(event);
        EventProcessor processor = processors.get(event.unitType());
        switch (type) {
            case CREATE -> processor.create(event);
            case START -> processor.start(event);
            case STOP -> processor.stop(event);
            case DESTROY -> processor.destroy(event);
            case PAUSE -> processor.pause(event);
            case UNPAUSE -> processor.unpause(event);
            default -> throw new UnknownEventTypeException(event.eventType());
        }
    }
}
