package com.botcore.toolgate.application.tuning;

/**
 * How much human involvement a parameter change needs.
 *
 * - GREEN: applied immediately, the operator is only notified
 * - YELLOW: applied after a confirmation token round-trip
 * - RED: capital or engine level change, applied only after a critical confirmation
 */
public enum TuningTier {
    GREEN,
    YELLOW,
    RED
}
