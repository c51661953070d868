package com.tekir.backend.modules.quota.application;

import java.security.SecureRandom;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class SessionTokenGenerator {

    static final int MIN_TOKEN_LENGTH = 64;
    private static final char[] ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789".toCharArray();
    private static final int VISIBLE_PREFIX = 8;

    private final SecureRandom secureRandom = new SecureRandom();
    private final int tokenLength;

    public SessionTokenGenerator(@Value("${tekir.session.token-length:64}") int tokenLength) {
        this.tokenLength = Math.max(tokenLength, MIN_TOKEN_LENGTH);
    }

    public String generate() {
        char[] token = new char[tokenLength];
        for (int i = 0; i < tokenLength; i++) {
            token[i] = ALPHABET[secureRandom.nextInt(ALPHABET.length)];
        }
        return new String(token);
    }

    public int tokenLength() {
        return tokenLength;
    }

    /** Log-safe form of a session token. */
    public static String abbreviate(String token) {
        if (token == null) {
            return "null";
        }
        return token.length() <= VISIBLE_PREFIX ? "***" : token.substring(0, VISIBLE_PREFIX) + "...";
    }
}
