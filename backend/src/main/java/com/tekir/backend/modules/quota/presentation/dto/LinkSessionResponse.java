package com.tekir.backend.modules.quota.presentation.dto;

public record LinkSessionResponse(String sessionToken, boolean changed, int limit) {
}
