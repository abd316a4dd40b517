package io.enforcerlink.monitor;

/**
 * Policy-side collaborator that is told about unit runtimes and transitions.
 */
public interface UnitHandler {
    void createUnitRuntime(String unitId, UnitRuntime runtime) throws Exception;

    void handleUnitEvent(String unitId, EventType event) throws Exception;
}
