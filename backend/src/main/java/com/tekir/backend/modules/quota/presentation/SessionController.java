package com.tekir.backend.modules.quota.presentation;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.tekir.backend.global.common.time.QuotaDays;
import com.tekir.backend.global.error.ProblemException;
import com.tekir.backend.global.error.RetryableProblemException;
import com.tekir.backend.global.security.SecurityUtils;
import com.tekir.backend.modules.quota.application.IssueSessionCommand;
import com.tekir.backend.modules.quota.application.IssuedSession;
import com.tekir.backend.modules.quota.application.LinkSessionCommand;
import com.tekir.backend.modules.quota.application.QuotaDecision;
import com.tekir.backend.modules.quota.application.QuotaEnforcer;
import com.tekir.backend.modules.quota.application.QuotaStatus;
import com.tekir.backend.modules.quota.application.QuotaStatusReporter;
import com.tekir.backend.modules.quota.application.SessionIssuer;
import com.tekir.backend.modules.quota.application.SessionLinker;
import com.tekir.backend.modules.quota.presentation.dto.ConsumeQuotaResponse;
import com.tekir.backend.modules.quota.presentation.dto.LinkSessionRequest;
import com.tekir.backend.modules.quota.presentation.dto.LinkSessionResponse;
import com.tekir.backend.modules.quota.presentation.dto.QuotaStatusResponse;
import com.tekir.backend.modules.quota.presentation.dto.RegisterSessionResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/session")
public class SessionController {

    public static final String LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    public static final String RESET_HEADER = "X-RateLimit-Reset";

    private final SessionIssuer sessionIssuer;
    private final SessionLinker sessionLinker;
    private final QuotaEnforcer quotaEnforcer;
    private final QuotaStatusReporter statusReporter;
    private final ClientFingerprintResolver fingerprintResolver;
    private final Clock clock;
    private final Duration sessionTtl;
    private final String cookieName;
    private final boolean secureCookie;

    public SessionController(
            SessionIssuer sessionIssuer,
            SessionLinker sessionLinker,
            QuotaEnforcer quotaEnforcer,
            QuotaStatusReporter statusReporter,
            ClientFingerprintResolver fingerprintResolver,
            Clock clock,
            @Value("${tekir.session.ttl:PT24H}") Duration sessionTtl,
            @Value("${tekir.session.cookie-name:session-token}") String cookieName,
            @Value("${tekir.session.cookie-secure:false}") boolean secureCookie
    ) {
        this.sessionIssuer = sessionIssuer;
        this.sessionLinker = sessionLinker;
        this.quotaEnforcer = quotaEnforcer;
        this.statusReporter = statusReporter;
        this.fingerprintResolver = fingerprintResolver;
        this.clock = clock;
        this.sessionTtl = sessionTtl;
        this.cookieName = cookieName;
        this.secureCookie = secureCookie;
    }

    @Operation(summary = "Issue or reuse a session", description = "Returns the caller's canonical session token and sets it as a cookie.")
    @PostMapping("/register")
    public ResponseEntity<RegisterSessionResponse> register(HttpServletRequest request) {
        ClientFingerprint fingerprint = fingerprintResolver.resolve(request);
        UUID userId = SecurityUtils.findCurrentUserId().orElse(null);

        IssuedSession issued = sessionIssuer.issueOrReuse(
                new IssueSessionCommand(userId, fingerprint.hashedIp(), fingerprint.deviceId(), sessionTtl));

        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, sessionCookie(issued.token()).toString())
                .body(new RegisterSessionResponse(issued.token(), issued.limit(), issued.existing(), issued.expiresAt()));
    }

    @Operation(summary = "Link the current session to the signed-in account")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Linked; the cookie is replaced when the token changed"),
            @ApiResponse(responseCode = "204", description = "No session to link"),
            @ApiResponse(responseCode = "403", description = "Target account is not the caller"),
            @ApiResponse(responseCode = "422", description = "Body sent without a userId")
    })
    @PostMapping("/link")
    public ResponseEntity<LinkSessionResponse> link(
            @Valid @RequestBody(required = false) LinkSessionRequest body,
            HttpServletRequest request
    ) {
        UUID callerId = SecurityUtils.getCurrentUserId();
        UUID targetUserId = body != null ? body.userId() : callerId;
        String token = fingerprintResolver.sessionToken(request);

        return sessionLinker.link(new LinkSessionCommand(token, targetUserId, callerId))
                .map(linked -> {
                    ResponseEntity.BodyBuilder builder = ResponseEntity.ok();
                    if (linked.changed()) {
                        builder.header(HttpHeaders.SET_COOKIE, sessionCookie(linked.token()).toString());
                    }
                    return builder.body(new LinkSessionResponse(linked.token(), linked.changed(), linked.limit()));
                })
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @Operation(summary = "Current quota status of the session")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session is valid"),
            @ApiResponse(responseCode = "401", description = "Session token missing, unknown or expired")
    })
    @GetMapping("/status")
    public ResponseEntity<QuotaStatusResponse> status(HttpServletRequest request) {
        String token = requireToken(request);
        QuotaStatus status = statusReporter.status(token);
        if (!status.valid()) {
            throw ProblemException.unauthorized("SESSION_INVALID", "Session is unknown or expired");
        }
        return ResponseEntity.ok()
                .headers(rateLimitHeaders(status.limit(), status.remaining()))
                .body(QuotaStatusResponse.from(status));
    }

    @Operation(summary = "Consume one request from the daily quota")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Request allowed"),
            @ApiResponse(responseCode = "401", description = "Session token missing, unknown or expired"),
            @ApiResponse(responseCode = "429", description = "Daily quota exhausted")
    })
    @PostMapping("/consume")
    public ResponseEntity<ConsumeQuotaResponse> consume(HttpServletRequest request) {
        String token = requireToken(request);
        QuotaDecision decision = quotaEnforcer.consume(token);
        if (decision.sessionInvalid()) {
            throw ProblemException.unauthorized("SESSION_INVALID", "Session is unknown or expired");
        }
        if (!decision.allowed()) {
            throw RetryableProblemException.tooManyRequests("QUOTA_EXCEEDED",
                    "Daily limit of " + decision.limit() + " requests reached",
                    QuotaDays.untilReset(clock));
        }
        OffsetDateTime resetTime = QuotaDays.nextReset(clock);
        return ResponseEntity.ok()
                .headers(rateLimitHeaders(decision.limit(), decision.remaining()))
                .body(new ConsumeQuotaResponse(true, decision.currentCount(), decision.limit(), decision.remaining(), resetTime));
    }

    private String requireToken(HttpServletRequest request) {
        String token = fingerprintResolver.sessionToken(request);
        if (token == null) {
            throw ProblemException.unauthorized("SESSION_TOKEN_MISSING", "No session token presented");
        }
        return token;
    }

    private HttpHeaders rateLimitHeaders(int limit, int remaining) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(LIMIT_HEADER, String.valueOf(limit));
        headers.set(REMAINING_HEADER, String.valueOf(remaining));
        headers.set(RESET_HEADER, String.valueOf(QuotaDays.nextReset(clock).toEpochSecond()));
        return headers;
    }

    private ResponseCookie sessionCookie(String token) {
        return ResponseCookie.from(cookieName, token)
                .httpOnly(true)
                .secure(secureCookie)
                .sameSite("Lax")
                .path("/")
                .maxAge(sessionTtl)
                .build();
    }
}
