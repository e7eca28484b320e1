package com.botcore.toolgate.application.ratelimit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Category -> rule table. Categories without an entry fall back to a conservative default.
 */
public final class RateLimitPolicy {

    public static final RateLimitRule CONSERVATIVE_DEFAULT = new RateLimitRule(30, 60_000);

    private final Map<String, RateLimitRule> rules;
    private final RateLimitRule fallback;

    public RateLimitPolicy(Map<String, RateLimitRule> rules, RateLimitRule fallback) {
        Map<String, RateLimitRule> copy = new LinkedHashMap<>();
        if (rules != null) {
            rules.forEach((k, v) -> copy.put(normalize(k), Objects.requireNonNull(v, "rule for " + k)));
        }
        this.rules = Collections.unmodifiableMap(copy);
        this.fallback = fallback == null ? CONSERVATIVE_DEFAULT : fallback;
    }

    /** Built-in table used when no override is configured. */
    public static RateLimitPolicy defaults() {
        Map<String, RateLimitRule> m = new LinkedHashMap<>();
        m.put("market", new RateLimitRule(60, 60_000));
        m.put("paper-trading", new RateLimitRule(60, 60_000));
        m.put("real-trading", new RateLimitRule(30, 60_000));
        m.put("ai", new RateLimitRule(10, 60_000));
        m.put("settings", new RateLimitRule(20, 60_000));
        m.put("health", new RateLimitRule(120, 60_000));
        return new RateLimitPolicy(m, CONSERVATIVE_DEFAULT);
    }

    /**
     * Parses "real-trading=30/60000, ai=10/60000, default=30/60000" on top of the built-in table.
     * The special category "default" replaces the fallback rule.
     */
    public static RateLimitPolicy parse(String table) {
        RateLimitPolicy base = defaults();
        if (table == null || table.isBlank()) return base;

        Map<String, RateLimitRule> m = new LinkedHashMap<>(base.rules);
        RateLimitRule fb = base.fallback;
        for (String entry : table.split(",")) {
            String t = entry.trim();
            if (t.isEmpty()) continue;
            int eq = t.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("rate limit entry must look like category=max/windowMs: " + t);
            }
            String category = normalize(t.substring(0, eq));
            RateLimitRule rule = RateLimitRule.parse(t.substring(eq + 1));
            if ("default".equals(category)) {
                fb = rule;
            } else {
                m.put(category, rule);
            }
        }
        return new RateLimitPolicy(m, fb);
    }

    public RateLimitRule ruleFor(String category) {
        RateLimitRule r = rules.get(normalize(category));
        return r == null ? fallback : r;
    }

    public RateLimitRule fallback() {
        return fallback;
    }

    public Map<String, RateLimitRule> rules() {
        return rules;
    }

    private static String normalize(String category) {
        return category == null ? "" : category.trim().toLowerCase(Locale.ROOT);
    }
}
