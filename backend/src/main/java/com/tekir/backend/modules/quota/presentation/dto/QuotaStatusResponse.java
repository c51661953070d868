package com.tekir.backend.modules.quota.presentation.dto;

import java.time.OffsetDateTime;

import com.tekir.backend.modules.quota.application.QuotaStatus;

import com.fasterxml.jackson.annotation.JsonProperty;

public record QuotaStatusResponse(
        @JsonProperty("isValid") boolean isValid,
        int currentCount,
        int limit,
        int remaining,
        @JsonProperty("isAuthenticated") boolean isAuthenticated,
        OffsetDateTime resetTime
) {

    public static QuotaStatusResponse from(QuotaStatus status) {
        return new QuotaStatusResponse(
                status.valid(),
                status.currentCount(),
                status.limit(),
                status.remaining(),
                status.authenticated(),
                status.resetTime()
        );
    }
}
