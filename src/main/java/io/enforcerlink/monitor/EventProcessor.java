package io.enforcerlink.monitor;

/**
 * Lifecycle handler for one {@link UnitType}. Exceptions are returned to the
 * caller of {@code HandleEvent} exactly as thrown.
 */
public interface EventProcessor {
    void create(EventInfo event) throws Exception;

    void start(EventInfo event) throws Exception;

    void stop(EventInfo event) throws Exception;

    void destroy(EventInfo event) throws Exception;

    default void pause(EventInfo event) throws Exception {
        throw new UnsupportedOperationException("pause is not supported for unit type " + event.unitType());
    }

    default void unpause(EventInfo event) throws Exception {
        throw new UnsupportedOperationException("unpause is not supported for unit type " + event.unitType());
    }
}
