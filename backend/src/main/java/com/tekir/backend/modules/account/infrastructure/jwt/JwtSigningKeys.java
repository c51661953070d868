package com.tekir.backend.modules.account.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

/**
 * HS256 key material shared with the identity provider that signs access tokens.
 */
public final class JwtSigningKeys {

    public static final int MIN_KEY_BYTES = 32;

    private JwtSigningKeys() {
    }

    /** Base64 secrets are decoded; anything else is used as raw UTF-8 bytes. */
    public static SecretKey hs256(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("jwt.secret is not configured");
        }
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(secret.trim());
        } catch (IllegalArgumentException ex) {
            keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        }
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("jwt.secret must be at least " + MIN_KEY_BYTES + " bytes for HS256");
        }
        return new SecretKeySpec(keyBytes, "HmacSHA256");
    }
}
