package com.ranco.auth.modules.session.domain;

/**
 * Where a session was started from. Both parts are optional.
 */
public record ClientMeta(String ipAddress, String userAgent) {

    private static final int IP_ADDRESS_MAX_LENGTH = 45;
    private static final int USER_AGENT_MAX_LENGTH = 512;

    public ClientMeta {
        ipAddress = normalize(ipAddress, IP_ADDRESS_MAX_LENGTH);
        userAgent = normalize(userAgent, USER_AGENT_MAX_LENGTH);
    }

    public static ClientMeta unknown() {
        return new ClientMeta(null, null);
    }

    private static String normalize(String raw, int maxLength) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > maxLength ? trimmed.substring(0, maxLength) : trimmed;
    }
}
