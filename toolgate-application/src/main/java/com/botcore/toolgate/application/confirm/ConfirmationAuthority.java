package com.botcore.toolgate.application.confirm;

import com.botcore.toolgate.application.ports.ParamsCanonicalizer;
import com.botcore.toolgate.application.ports.UsedTokenStore;
import com.botcore.toolgate.domain.tool.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;

/**
 * Tiered human-in-the-loop confirmation for sensitive and critical tools.
 *
 * Token wire format: {@code <digest>:<issuedAtMillis>} where digest is the truncated HMAC of
 * (toolName, paramsFingerprint, issuedAt). Binding to the fingerprint means an approval for one
 * order cannot be replayed against a different order of the same tool.
 *
 * Token lifecycle: issued -> consumed | expired. Both terminal states reject.
 */
public class ConfirmationAuthority {

    private static final Logger log = LoggerFactory.getLogger(ConfirmationAuthority.class);

    public static final String INVALID_TOKEN_REASON = "invalid or expired confirmation token";
    public static final String CONFIRM_TOKEN_PARAM = "confirm_token";

    private final ConfirmationSigner signer;
    private final ParamsCanonicalizer canonicalizer;
    private final UsedTokenStore usedTokens;
    private final Clock clock;
    private final long ttlMs;

    public ConfirmationAuthority(ConfirmationSigner signer,
                                 ParamsCanonicalizer canonicalizer,
                                 UsedTokenStore usedTokens,
                                 Clock clock,
                                 long ttlMs) {
        this.signer = Objects.requireNonNull(signer, "signer");
        this.canonicalizer = Objects.requireNonNull(canonicalizer, "canonicalizer");
        this.usedTokens = Objects.requireNonNull(usedTokens, "usedTokens");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (ttlMs <= 0) throw new IllegalArgumentException("ttlMs must be positive");
        this.ttlMs = ttlMs;
    }

    public ConfirmationDecision check(String toolName, Tier tier, Map<String, Object> parameters, String suppliedToken) {
        if (!tier.requiresConfirmation()) {
            return ConfirmationDecision.proceed();
        }

        String canonical = canonicalizer.canonicalize(parameters);
        String fingerprint = ConfirmationSigner.fingerprint(canonical);

        if (suppliedToken != null && !suppliedToken.isBlank()) {
            if (validate(suppliedToken, toolName, fingerprint)) {
                log.info("[CONFIRM] accepted tool={} tier={}", toolName, tier);
                return ConfirmationDecision.proceed();
            }
            log.warn("[CONFIRM] rejected tool={} tier={} token={}", toolName, tier, abbreviate(suppliedToken));
            return ConfirmationDecision.reject(INVALID_TOKEN_REASON);
        }

        String token = issue(toolName, fingerprint);
        log.info("[CONFIRM] required tool={} tier={}", toolName, tier);
        return ConfirmationDecision.requireConfirmation(prompt(toolName, tier, canonical, token), token);
    }

    /** Issues a token bound to (toolName, paramsFingerprint, now). */
    public String issue(String toolName, String paramsFingerprint) {
        long issuedAt = clock.millis();
        return signer.digest(toolName, paramsFingerprint, issuedAt) + ":" + issuedAt;
    }

    /**
     * Validates and consumes the token. Returns true at most once per token.
     */
    public boolean validate(String token, String toolName, String paramsFingerprint) {
        if (token == null || usedTokens.contains(token)) {
            return false;
        }

        String[] parts = token.split(":", -1);
        if (parts.length != 2 || parts[0].isEmpty()) {
            return false;
        }
        Long issuedAt = parseMillis(parts[1]);
        if (issuedAt == null) {
            return false;
        }

        if (clock.millis() - issuedAt > ttlMs) {
            return false;
        }

        String expected = signer.digest(toolName, paramsFingerprint, issuedAt);
        if (!ConfirmationSigner.sameDigest(expected, parts[0])) {
            return false;
        }

        // check-then-insert: only the thread that actually inserts wins
        return usedTokens.markUsed(token);
    }

    public String fingerprint(Map<String, Object> parameters) {
        return ConfirmationSigner.fingerprint(canonicalizer.canonicalize(parameters));
    }

    /**
     * Forgets consumed tokens that are past the TTL; those are rejected by the age check anyway.
     *
     * @return number of removed entries
     */
    public int sweepUsedTokens() {
        long cutoff = clock.millis() - ttlMs;
        int removed = usedTokens.removeIf(t -> {
            Long issuedAt = issuedAtOf(t);
            return issuedAt == null || issuedAt < cutoff;
        });
        if (removed > 0) {
            log.debug("[CONFIRM] sweep removed={} remaining={}", removed, usedTokens.size());
        }
        return removed;
    }

    public long ttlMs() {
        return ttlMs;
    }

    private static String prompt(String toolName, Tier tier, String canonicalParams, String token) {
        return "CONFIRMATION REQUIRED [" + tier.name() + "]\n"
                + "Tool: " + toolName + "\n"
                + "Parameters: " + canonicalParams + "\n\n"
                + "This operation was not executed. Review it with the operator, then call the tool again "
                + "with the same parameters plus " + CONFIRM_TOKEN_PARAM + ": \"" + token + "\"";
    }

    private static Long issuedAtOf(String token) {
        int idx = token.lastIndexOf(':');
        return idx < 0 ? null : parseMillis(token.substring(idx + 1));
    }

    private static Long parseMillis(String s) {
        if (s.isEmpty()) return null;
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return null;
        }
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String abbreviate(String token) {
        return token.length() <= 8 ? "***" : token.substring(0, 8) + "...";
    }
}
