package com.tekir.backend.modules.quota.application;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Analytics record of a quota decision. Carries an abbreviated token only.
 */
public record QuotaEvent(
        Type type,
        String tokenPrefix,
        UUID userId,
        int currentCount,
        int limit,
        OffsetDateTime occurredAt
) {

    public enum Type {
        SESSION_ISSUED,
        SESSION_REUSED,
        SESSION_LINKED,
        REQUEST_ALLOWED,
        REQUEST_DENIED,
        CONFLICT_REREAD
    }
}
