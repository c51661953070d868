package com.tekir.backend.modules.quota.presentation;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.tekir.backend.global.security.SecurityUtils;
import com.tekir.backend.modules.quota.application.SessionJanitor;
import com.tekir.backend.modules.quota.presentation.dto.SweepResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/sessions")
public class AdminSessionController {

    private final SessionJanitor sessionJanitor;
    private final Clock clock;

    public AdminSessionController(SessionJanitor sessionJanitor, Clock clock) {
        this.sessionJanitor = sessionJanitor;
        this.clock = clock;
    }

    @Operation(summary = "Delete one batch of expired sessions")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Batch processed; hasMore signals remaining work"),
            @ApiResponse(responseCode = "403", description = "Administrator role required")
    })
    @PostMapping("/sweep-expired")
    public ResponseEntity<SweepResponse> sweepExpired() {
        return ResponseEntity.ok(SweepResponse.of(
                sessionJanitor.sweepExpiredSessionsAsAdmin(SecurityUtils.getCurrentUserId()),
                OffsetDateTime.now(clock)));
    }

    @Operation(summary = "Reset daily request counts", description = "Runs a bounded reset pass; call again while hasMore is true.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Pass completed"),
            @ApiResponse(responseCode = "403", description = "Administrator role required")
    })
    @PostMapping("/reset-daily")
    public ResponseEntity<SweepResponse> resetDaily() {
        return ResponseEntity.ok(SweepResponse.of(
                sessionJanitor.resetDailyCountsAsAdmin(SecurityUtils.getCurrentUserId()),
                OffsetDateTime.now(clock)));
    }
}
