package net.ohaasarelay.application.dispatch;

/**
 * What started a dispatch. Only {@link #SCHEDULED} dispatches are tied to the day marker.
 */
public enum DispatchTrigger {
    SCHEDULED,
    MANUAL
}
