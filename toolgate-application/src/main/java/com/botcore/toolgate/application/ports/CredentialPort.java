package com.botcore.toolgate.application.ports;

/**
 * Supplies the outbound bearer credential for the protected backend.
 */
public interface CredentialPort {

    /**
     * Returns a usable token, refreshing it when needed.
     * Never throws: on failure returns an empty string and lets the backend's 401 surface.
     */
    String getCredential();

    /**
     * Like {@link #getCredential()}, but a login it has to perform (or wait for) may take at most budgetMs.
     * Out of budget it returns an empty string; a still-fresh cached token is returned even with no budget left.
     */
    default String getCredential(long budgetMs) {
        return getCredential();
    }

    /** Drops the cached credential so the next call performs a fresh login. */
    void invalidate();
}
