package com.botcore.toolgate.application.ratelimit;

public record RateDecision(boolean allowed, long retryAfterSeconds) {

    private static final RateDecision ALLOWED = new RateDecision(true, 0);

    public static RateDecision allow() {
        return ALLOWED;
    }

    public static RateDecision deny(long retryAfterSeconds) {
        return new RateDecision(false, retryAfterSeconds);
    }
}
