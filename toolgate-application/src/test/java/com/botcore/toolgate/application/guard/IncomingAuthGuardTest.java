package com.botcore.toolgate.application.guard;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IncomingAuthGuardTest {

    @Test
    void openModeAcceptsEverything() {
        IncomingAuthGuard guard = new IncomingAuthGuard(null);

        assertThat(guard.isOpen()).isTrue();
        assertThat(guard.validate(null)).isTrue();
        assertThat(guard.validate("Bearer whatever")).isTrue();
    }

    @Test
    void blankSecretMeansOpenMode() {
        assertThat(new IncomingAuthGuard("  ").isOpen()).isTrue();
    }

    @Test
    void acceptsExactSecretWithOrWithoutBearerPrefix() {
        IncomingAuthGuard guard = new IncomingAuthGuard("s3cret");

        assertThat(guard.isOpen()).isFalse();
        assertThat(guard.validate("Bearer s3cret")).isTrue();
        assertThat(guard.validate("s3cret")).isTrue();
    }

    @Test
    void rejectsMissingOrDifferentSecret() {
        IncomingAuthGuard guard = new IncomingAuthGuard("s3cret");

        assertThat(guard.validate(null)).isFalse();
        assertThat(guard.validate("")).isFalse();
        assertThat(guard.validate("Bearer ")).isFalse();
        assertThat(guard.validate("Bearer s3cret2")).isFalse();
        assertThat(guard.validate("Bearer S3CRET")).isFalse();
        assertThat(guard.validate("Bearer  s3cret")).isFalse();
        assertThat(guard.validate("bearer s3cret")).isFalse();
    }
}
