package com.tekir.backend.modules.quota.presentation.dto;

import java.time.OffsetDateTime;

import com.tekir.backend.modules.quota.application.SweepResult;

public record SweepResponse(int processed, int failed, boolean hasMore, OffsetDateTime executedAt) {

    public static SweepResponse of(SweepResult result, OffsetDateTime executedAt) {
        return new SweepResponse(result.processed(), result.failed(), result.hasMore(), executedAt);
    }
}
