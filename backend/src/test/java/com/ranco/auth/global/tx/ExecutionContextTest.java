package com.ranco.auth.global.tx;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import com.ranco.auth.global.error.ErrorKind;
import com.ranco.auth.global.error.IdentityException;

import org.junit.jupiter.api.Test;

class ExecutionContextTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void liveContextPassesAndReportsRemainingTime() {
        ExecutionContext context = ExecutionContext.withTimeout(clock, Duration.ofSeconds(10));

        assertThatCode(() -> context.ensureActive(clock)).doesNotThrowAnyException();
        assertThat(context.remaining(clock)).contains(Duration.ofSeconds(10));
    }

    @Test
    void cancelledContextFailsWithCancelled() {
        ExecutionContext context = ExecutionContext.withTimeout(clock, Duration.ofSeconds(10));
        context.cancel();

        assertThatThrownBy(() -> context.ensureActive(clock))
                .isInstanceOfSatisfying(IdentityException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ErrorKind.CANCELLED);
                    assertThat(ex.getCode()).isEqualTo(ExecutionContext.OPERATION_CANCELLED);
                });
    }

    @Test
    void contextPastDeadlineFails() {
        ExecutionContext context = ExecutionContext.withDeadline(NOW.minusMillis(1));

        assertThatThrownBy(() -> context.ensureActive(clock))
                .isInstanceOfSatisfying(IdentityException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(ExecutionContext.DEADLINE_EXCEEDED));
        assertThat(context.remaining(clock)).contains(Duration.ZERO);
    }

    @Test
    void backgroundContextHasNoDeadline() {
        ExecutionContext context = ExecutionContext.background();

        assertThat(context.deadline()).isEmpty();
        assertThat(context.remaining(clock)).isEmpty();
        assertThatCode(() -> context.ensureActive(clock)).doesNotThrowAnyException();
    }
}
