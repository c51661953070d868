package com.tekir.backend.global.security;

import java.util.List;
import java.util.UUID;

public record JwtAuthenticationPrincipal(UUID userId, String email, List<String> roles) {

    public JwtAuthenticationPrincipal {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }
}
