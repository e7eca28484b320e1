package com.botcore.toolgate.domain.gate;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolResultTest {

    @Test
    void failureWithoutMessageFallsBackToCode() {
        ToolResult r = ToolResult.failure(FailureCode.TIMEOUT, " ");
        assertThat(r.success()).isFalse();
        assertThat(r.error()).isEqualTo("TIMEOUT");
    }

    @Test
    void failureRequiresCode() {
        assertThatThrownBy(() -> new ToolResult(false, null, "boom", null, null, null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void rateLimitedCarriesRetryAfter() {
        ToolResult r = ToolResult.rateLimited("real-trading", 42);
        assertThat(r.code()).isEqualTo(FailureCode.RATE_LIMITED);
        assertThat(r.retryAfterSeconds()).isEqualTo(42L);
        assertThat(r.error()).contains("real-trading").contains("42");
    }

    @Test
    void confirmationRequiredIsNotAnExecution() {
        ToolResult r = ToolResult.confirmationRequired("confirm please", "abc:1");
        assertThat(r.success()).isFalse();
        assertThat(r.awaitingConfirmation()).isTrue();
        assertThat(r.confirmToken()).isEqualTo("abc:1");
    }
}
