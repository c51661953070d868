package com.tekir.backend.modules.account.application;

import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import javax.crypto.SecretKey;

import com.tekir.backend.modules.account.infrastructure.jwt.JwtSigningKeys;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Verifies the bearer access tokens minted by the identity provider at sign-in.
 * Tokens must carry a UUID subject and an expiry; {@code jwt.issuer}, when set, must match {@code iss}.
 */
@Service
public class AccessTokenVerifier {

    private final JwtParser parser;

    public AccessTokenVerifier(
            @Value("${jwt.secret}") String secret,
            @Value("${jwt.issuer:}") String expectedIssuer,
            Clock clock
    ) {
        SecretKey key = JwtSigningKeys.hs256(secret);
        JwtParserBuilder builder = Jwts.parser()
                .verifyWith(key)
                .clock(() -> Date.from(clock.instant()));
        if (StringUtils.hasText(expectedIssuer)) {
            builder.requireIssuer(expectedIssuer.trim());
        }
        this.parser = builder.build();
    }

    public VerifiedAccessToken verify(String token) {
        if (!StringUtils.hasText(token)) {
            throw new InvalidAccessTokenException("Access token is empty", null);
        }
        Claims claims;
        try {
            claims = parser.parseSignedClaims(token.trim()).getPayload();
        } catch (JwtException | IllegalArgumentException ex) {
            throw new InvalidAccessTokenException("Invalid access token", ex);
        }
        if (claims.getExpiration() == null) {
            throw new InvalidAccessTokenException("Access token has no expiry", null);
        }
        return new VerifiedAccessToken(accountId(claims), claims.get("email", String.class), roles(claims),
                claims.getExpiration().toInstant());
    }

    private static UUID accountId(Claims claims) {
        String subject = claims.getSubject();
        if (!StringUtils.hasText(subject)) {
            throw new InvalidAccessTokenException("Access token has no subject", null);
        }
        try {
            return UUID.fromString(subject);
        } catch (IllegalArgumentException ex) {
            throw new InvalidAccessTokenException("Access token subject is not an account id", ex);
        }
    }

    private static List<String> roles(Claims claims) {
        Object raw = claims.get("roles");
        if (!(raw instanceof List<?> list)) {
            return List.of();
        }
        return list.stream()
                .filter(Objects::nonNull)
                .map(Object::toString)
                .filter(StringUtils::hasText)
                .toList();
    }

    public record VerifiedAccessToken(UUID accountId, String email, List<String> roles, Instant expiresAt) {
    }

    public static class InvalidAccessTokenException extends RuntimeException {
        public InvalidAccessTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
