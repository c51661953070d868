package com.tekir.backend.support;

import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.UUID;

import com.tekir.backend.modules.account.infrastructure.jwt.JwtSigningKeys;

import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;

/**
 * Mints access tokens the way the identity provider does at sign-in.
 */
public final class TestAccessTokens {

    private TestAccessTokens() {
    }

    public static String mint(String secret, String issuer, UUID accountId, String email, List<String> roles,
                              Instant issuedAt, Duration ttl) {
        JwtBuilder builder = Jwts.builder()
                .subject(accountId.toString())
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(issuedAt.plus(ttl)))
                .claim("email", email)
                .claim("roles", roles)
                .signWith(JwtSigningKeys.hs256(secret), Jwts.SIG.HS256);
        if (issuer != null) {
            builder.issuer(issuer);
        }
        return builder.compact();
    }
}
