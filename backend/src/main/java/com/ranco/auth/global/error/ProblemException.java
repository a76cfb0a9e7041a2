package com.ranco.auth.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Failure rendered as a problem body: a stable machine code plus a caller-safe detail.
 */
public class ProblemException extends ResponseStatusException {

    private final String code;
    private final String detailMessage;

    public ProblemException(HttpStatus status, String code, String detailMessage, Throwable cause) {
        super(status, code, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code must not be blank");
        }
        this.code = code;
        this.detailMessage = (detailMessage == null || detailMessage.isBlank()) ? status.getReasonPhrase() : detailMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detailMessage;
    }
}
