package io.enforcerlink.monitor;

/**
 * Thrown by a processor asked to create a unit it already tracks. Resync
 * treats it as a successful reconciliation.
 */
public final class UnitAlreadyTrackedException extends IllegalStateException {
    private final String unitId;

    public UnitAlreadyTrackedException(String unitId) {
        super("unit already tracked: " + unitId);
        this.unitId = unitId;
    }

    public String unitId() {
        return unitId;
    }
}
