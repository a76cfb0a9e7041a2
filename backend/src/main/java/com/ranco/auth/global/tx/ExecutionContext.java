package com.ranco.auth.global.tx;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import com.ranco.auth.global.error.IdentityException;

/**
 * Bounded lifetime handed to every engine operation. A unit of work checks it before each
 * repository access and rolls back once it is cancelled or past its deadline.
 */
public final class ExecutionContext {

    public static final String OPERATION_CANCELLED = "OPERATION_CANCELLED";
    public static final String DEADLINE_EXCEEDED = "DEADLINE_EXCEEDED";

    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private ExecutionContext(Instant deadline) {
        this.deadline = deadline;
    }

    public static ExecutionContext withTimeout(Clock clock, Duration timeout) {
        return new ExecutionContext(clock.instant().plus(timeout));
    }

    public static ExecutionContext withDeadline(Instant deadline) {
        return new ExecutionContext(deadline);
    }

    /**
     * Context without a deadline, for scheduled jobs.
     */
    public static ExecutionContext background() {
        return new ExecutionContext(null);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    public Optional<Duration> remaining(Clock clock) {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    public void ensureActive(Clock clock) {
        if (cancelled.get()) {
            throw IdentityException.cancelled(OPERATION_CANCELLED);
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            throw IdentityException.cancelled(DEADLINE_EXCEEDED);
        }
    }
}
