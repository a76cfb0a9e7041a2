package com.ranco.auth.global.crypto;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * HMAC-SHA256 keyed with a server-side pepper. Deterministic, so hashes double as lookup keys.
 */
@Component
public class HmacCredentialHasher implements CredentialHasher {

    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKeySpec key;

    public HmacCredentialHasher(@Value("${app.identity.hash-pepper}") String pepper) {
        if (pepper == null || pepper.isBlank()) {
            throw new IllegalArgumentException("app.identity.hash-pepper must not be blank");
        }
        this.key = new SecretKeySpec(pepper.getBytes(StandardCharsets.UTF_8), HMAC_SHA_256);
    }

    @Override
    public String hash(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext must not be null");
        }
        try {
            Mac mac = Mac.getInstance(HMAC_SHA_256);
            mac.init(key);
            byte[] out = mac.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(out);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC_SHA256_FAILED", e);
        }
    }

    @Override
    public boolean matches(String plaintext, String expectedHash) {
        if (plaintext == null || expectedHash == null) {
            return false;
        }
        byte[] actual = hash(plaintext).getBytes(StandardCharsets.US_ASCII);
        byte[] expected = expectedHash.getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(actual, expected);
    }
}
