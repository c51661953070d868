package com.tekir.backend.modules.quota.presentation.dto;

import java.time.OffsetDateTime;

public record RegisterSessionResponse(String sessionToken, int limit, boolean existing, OffsetDateTime expiresAt) {
}
