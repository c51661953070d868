package com.tekir.backend.modules.quota.application;

import java.time.OffsetDateTime;

public record QuotaStatus(
        boolean valid,
        int currentCount,
        int limit,
        int remaining,
        boolean authenticated,
        OffsetDateTime resetTime
) {
}
