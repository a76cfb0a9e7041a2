package com.ranco.auth.global.error;

/**
 * The only failure type that leaves the identity engine. Store and primitive errors are
 * translated into one of the {@link ErrorKind}s before they reach the request layer.
 */
public class IdentityException extends ProblemException {

    public static final String ACCOUNT_NOT_FOUND = "ACCOUNT_NOT_FOUND";
    public static final String ACCOUNT_ALREADY_EXISTS = "ACCOUNT_ALREADY_EXISTS";
    public static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";
    public static final String INVALID_OR_EXPIRED_CODE = "INVALID_OR_EXPIRED_CODE";
    public static final String INVALID_ACCOUNT_STATE = "INVALID_ACCOUNT_STATE";
    public static final String INVALID_TOKEN = "INVALID_TOKEN";
    public static final String CONSTRAINT_VIOLATION = "CONSTRAINT_VIOLATION";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final ErrorKind kind;

    public IdentityException(ErrorKind kind, String code) {
        this(kind, code, null);
    }

    public IdentityException(ErrorKind kind, String code, Throwable cause) {
        super(kind.status(), code, kind.defaultDetail(), cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static IdentityException notFound(String code) {
        return new IdentityException(ErrorKind.NOT_FOUND, code);
    }

    public static IdentityException conflict(String code) {
        return new IdentityException(ErrorKind.CONFLICT, code);
    }

    public static IdentityException conflict(String code, Throwable cause) {
        return new IdentityException(ErrorKind.CONFLICT, code, cause);
    }

    public static IdentityException invalidCredentials() {
        return new IdentityException(ErrorKind.INVALID_CREDENTIALS, INVALID_CREDENTIALS);
    }

    public static IdentityException invalidOrExpiredCode() {
        return new IdentityException(ErrorKind.INVALID_OR_EXPIRED_CODE, INVALID_OR_EXPIRED_CODE);
    }

    public static IdentityException invalidAccountState() {
        return new IdentityException(ErrorKind.INVALID_ACCOUNT_STATE, INVALID_ACCOUNT_STATE);
    }

    public static IdentityException invalidToken() {
        return new IdentityException(ErrorKind.INVALID_TOKEN, INVALID_TOKEN);
    }

    public static IdentityException cancelled(String code) {
        return new IdentityException(ErrorKind.CANCELLED, code);
    }

    public static IdentityException cancelled(String code, Throwable cause) {
        return new IdentityException(ErrorKind.CANCELLED, code, cause);
    }

    public static IdentityException internal(Throwable cause) {
        return new IdentityException(ErrorKind.INTERNAL, INTERNAL_ERROR, cause);
    }
}
