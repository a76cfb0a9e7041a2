package com.ranco.auth.global.crypto;

/**
 * One-way hashing for verification codes and refresh secrets. Hashes are deterministic so
 * refresh tokens can be looked up by hash; comparisons are constant-time.
 */
public interface CredentialHasher {

    String hash(String plaintext);

    boolean matches(String plaintext, String expectedHash);
}
