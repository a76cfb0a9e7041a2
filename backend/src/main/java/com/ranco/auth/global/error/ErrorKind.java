package com.ranco.auth.global.error;

import org.springframework.http.HttpStatus;

/**
 * Coarse error categories the identity engine exposes. Messages are deliberately generic:
 * callers learn which kind of check failed, never which field or comparison.
 */
public enum ErrorKind {

    NOT_FOUND(HttpStatus.NOT_FOUND, "The requested resource does not exist."),
    CONFLICT(HttpStatus.CONFLICT, "The request conflicts with the current state."),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "The supplied credentials are not valid."),
    INVALID_OR_EXPIRED_CODE(HttpStatus.BAD_REQUEST, "The verification code is invalid or has expired."),
    INVALID_ACCOUNT_STATE(HttpStatus.FORBIDDEN, "The account is not in a state that allows this operation."),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "The supplied token is not valid."),
    CANCELLED(HttpStatus.SERVICE_UNAVAILABLE, "The operation was cancelled before it completed."),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred.");

    private final HttpStatus status;
    private final String defaultDetail;

    ErrorKind(HttpStatus status, String defaultDetail) {
        this.status = status;
        this.defaultDetail = defaultDetail;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultDetail() {
        return defaultDetail;
    }
}
