package com.botcore.toolgate.application.ratelimit;

/**
 * At most {@code max} calls inside any trailing {@code windowMs}.
 */
public record RateLimitRule(int max, long windowMs) {

    public RateLimitRule {
        if (max <= 0) throw new IllegalArgumentException("max must be positive: " + max);
        if (windowMs <= 0) throw new IllegalArgumentException("windowMs must be positive: " + windowMs);
    }

    /** Parses "30/60000". */
    public static RateLimitRule parse(String text) {
        if (text == null) throw new IllegalArgumentException("rate limit rule is null");
        String[] parts = text.trim().split("/");
        if (parts.length != 2) {
            throw new IllegalArgumentException("rate limit rule must look like max/windowMs: " + text);
        }
        try {
            return new RateLimitRule(Integer.parseInt(parts[0].trim()), Long.parseLong(parts[1].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("rate limit rule must look like max/windowMs: " + text, e);
        }
    }

    @Override
    public String toString() {
        return max + "/" + windowMs;
    }
}
