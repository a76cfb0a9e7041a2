package com.ranco.auth.modules.identity.domain;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Notification emitted after a committed identity change. Attributes never carry codes,
 * secrets or external ids.
 */
public record IdentityEvent(String name, UUID accountId, OffsetDateTime occurredAt, Map<String, String> attributes) {

    public static final String ACCOUNT_REGISTERED = "account.registered";
    public static final String ACCOUNT_VERIFIED = "account.verified";
    public static final String LOGIN_CODE_REQUESTED = "login_code.requested";
    public static final String SESSION_STARTED = "session.started";
    public static final String SESSION_REVOKED = "session.revoked";
    public static final String SESSION_REVOKED_ALL = "session.revoked_all";
    public static final String ACCOUNT_STATUS_CHANGED = "account.status_changed";

    public IdentityEvent {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(occurredAt, "occurredAt is required");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
