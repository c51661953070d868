package com.tekir.backend.modules.quota.presentation.dto;

import java.time.OffsetDateTime;

public record ConsumeQuotaResponse(boolean allowed, int currentCount, int limit, int remaining, OffsetDateTime resetTime) {
}
