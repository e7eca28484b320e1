package com.botcore.toolgate.domain.tool;

/**
 * Ordinal sensitivity of a tool: PUBLIC < AUTHENTICATED < SENSITIVE < CRITICAL.
 */
public enum Tier {
    PUBLIC,
    AUTHENTICATED,
    SENSITIVE,
    CRITICAL;

    /** SENSITIVE and CRITICAL calls must be confirmed by a human before they run. */
    public boolean requiresConfirmation() {
        return compareTo(SENSITIVE) >= 0;
    }

    public boolean atLeast(Tier other) {
        return compareTo(other) >= 0;
    }
}
