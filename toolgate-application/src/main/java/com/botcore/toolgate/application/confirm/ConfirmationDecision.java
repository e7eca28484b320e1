package com.botcore.toolgate.application.confirm;

/**
 * Outcome of {@link ConfirmationAuthority#check}.
 * message/token are set for REQUIRE_CONFIRMATION, reason for REJECT.
 */
public record ConfirmationDecision(Outcome outcome, String message, String token, String reason) {

    public enum Outcome { PROCEED, REQUIRE_CONFIRMATION, REJECT }

    private static final ConfirmationDecision PROCEED = new ConfirmationDecision(Outcome.PROCEED, null, null, null);

    public static ConfirmationDecision proceed() {
        return PROCEED;
    }

    public static ConfirmationDecision requireConfirmation(String message, String token) {
        return new ConfirmationDecision(Outcome.REQUIRE_CONFIRMATION, message, token, null);
    }

    public static ConfirmationDecision reject(String reason) {
        return new ConfirmationDecision(Outcome.REJECT, null, null, reason);
    }

    public boolean proceeds() {
        return outcome == Outcome.PROCEED;
    }
}
