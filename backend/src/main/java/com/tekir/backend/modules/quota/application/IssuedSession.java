package com.tekir.backend.modules.quota.application;

import java.time.OffsetDateTime;

public record IssuedSession(String token, int limit, boolean existing, OffsetDateTime expiresAt) {
}
