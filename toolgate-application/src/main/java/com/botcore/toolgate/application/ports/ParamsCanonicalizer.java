package com.botcore.toolgate.application.ports;

import java.util.Map;

/**
 * Turns arbitrary tool arguments into a stable string for hashing and display.
 * Equal argument maps must produce equal output regardless of key order.
 */
public interface ParamsCanonicalizer {

    String canonicalize(Map<String, Object> parameters);
}
