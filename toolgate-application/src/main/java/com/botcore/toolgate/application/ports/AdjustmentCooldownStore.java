package com.botcore.toolgate.application.ports;

/**
 * Remembers when each tunable parameter was last changed, so changes can be spaced out.
 * Process-local like the other stores; a restart clears every cooldown.
 */
public interface AdjustmentCooldownStore {

    /** Epoch millis of the last applied change, or null if never changed in this process. */
    Long lastAppliedAt(String parameter);

    void recordApplied(String parameter, long appliedAtMillis);
}
