package com.tekir.backend.modules.quota.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

/**
 * Body is optional; without it the session is linked to the signed-in account.
 * When a body is sent it must name the account.
 */
public record LinkSessionRequest(
        @NotNull UUID userId
) {
}
