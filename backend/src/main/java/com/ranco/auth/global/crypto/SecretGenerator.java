package com.ranco.auth.global.crypto;

import java.security.SecureRandom;
import java.util.Base64;

import org.springframework.stereotype.Component;

@Component
public class SecretGenerator {

    public static final int MIN_CODE_LENGTH = 4;
    public static final int MAX_CODE_LENGTH = 10;

    private final SecureRandom random = new SecureRandom();

    /**
     * Uniformly random decimal code, leading zeros kept.
     */
    public String numericCode(int digits) {
        if (digits < MIN_CODE_LENGTH || digits > MAX_CODE_LENGTH) {
            throw new IllegalArgumentException("digits must be between " + MIN_CODE_LENGTH + " and " + MAX_CODE_LENGTH);
        }
        StringBuilder sb = new StringBuilder(digits);
        for (int i = 0; i < digits; i++) {
            sb.append((char) ('0' + random.nextInt(10)));
        }
        return sb.toString();
    }

    /**
     * URL-safe opaque secret carrying {@code bytes} bytes of entropy.
     */
    public String opaqueToken(int bytes) {
        byte[] buf = new byte[bytes];
        random.nextBytes(buf);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buf);
    }
}
