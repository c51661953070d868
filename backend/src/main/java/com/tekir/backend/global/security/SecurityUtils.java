package com.tekir.backend.global.security;

import java.util.Optional;
import java.util.UUID;

import com.tekir.backend.global.error.ProblemException;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static Optional<JwtAuthenticationPrincipal> findCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal) {
            return Optional.of(principal);
        }
        return Optional.empty();
    }

    /** Session endpoints accept anonymous callers, so absence is not an error here. */
    public static Optional<UUID> findCurrentUserId() {
        return findCurrentPrincipal().map(JwtAuthenticationPrincipal::userId);
    }

    public static UUID getCurrentUserId() {
        return findCurrentUserId()
                .orElseThrow(() -> ProblemException.unauthorized("AUTHENTICATION_REQUIRED", "Sign in first"));
    }
}
