package com.botcore.toolgate.application.service;

import com.botcore.toolgate.domain.gate.ToolResult;

import java.util.Map;

/**
 * A tool answered inside the gateway instead of being proxied 1:1 to a backend endpoint.
 * It still runs behind the same auth, argument, rate-limit and confirmation stages.
 */
public interface InProcessTool {

    /**
     * Runs before rate limiting and confirmation; the returned map is what gets confirmed and executed.
     *
     * @throws IllegalArgumentException when the arguments cannot be accepted
     */
    default Map<String, Object> normalize(Map<String, Object> arguments) {
        return arguments;
    }

    /** Must not throw for expected failures; report them as a failed {@link ToolResult}. */
    ToolResult execute(Map<String, Object> arguments);
}
