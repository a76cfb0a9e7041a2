package com.ranco.auth.modules.verification.domain;

/**
 * Outcome of checking a supplied code. Only {@link #ACCEPTED} consumed anything; a
 * {@link #REJECTED} verdict has already counted the attempt.
 */
public enum CodeVerdict {
    ACCEPTED,
    REJECTED,
    NO_ACTIVE_CODE,
    ATTEMPTS_EXHAUSTED;

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
