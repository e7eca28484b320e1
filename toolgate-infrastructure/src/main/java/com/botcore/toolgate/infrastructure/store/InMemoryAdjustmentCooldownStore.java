package com.botcore.toolgate.infrastructure.store;

import com.botcore.toolgate.application.ports.AdjustmentCooldownStore;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Last-change timestamps per tunable parameter. Lost on restart.
 */
public final class InMemoryAdjustmentCooldownStore implements AdjustmentCooldownStore {

    private final ConcurrentHashMap<String, Long> lastApplied = new ConcurrentHashMap<>();

    @Override
    public Long lastAppliedAt(String parameter) {
        return parameter == null ? null : lastApplied.get(parameter);
    }

    @Override
    public void recordApplied(String parameter, long appliedAtMillis) {
        lastApplied.merge(parameter, appliedAtMillis, Math::max);
    }
}
