package com.tekir.backend.modules.quota.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.tekir.backend.modules.quota.domain.QuotaSession;
import com.tekir.backend.modules.quota.infrastructure.persistence.QuotaSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Hands out session tokens, reusing the live canonical session of an account or an anonymous origin.
 * Two concurrent first requests from the same identity converge on a single row: the loser of the
 * unique-index race re-reads the winner's row in a fresh transaction.
 */
@Service
public class SessionIssuer {

    private static final Logger log = LoggerFactory.getLogger(SessionIssuer.class);
    private static final int DEVICE_ID_MAX_LENGTH = 100;

    private final QuotaSessionRepository sessionRepository;
    private final QuotaPolicyResolver policyResolver;
    private final SessionTokenGenerator tokenGenerator;
    private final DailyCounterService dailyCounterService;
    private final QuotaEventSink eventSink;
    private final TransactionTemplate transactionTemplate;
    private final Duration defaultTtl;
    private final Clock clock;

    public SessionIssuer(
            QuotaSessionRepository sessionRepository,
            QuotaPolicyResolver policyResolver,
            SessionTokenGenerator tokenGenerator,
            DailyCounterService dailyCounterService,
            QuotaEventSink eventSink,
            PlatformTransactionManager transactionManager,
            @Value("${tekir.session.ttl:PT24H}") Duration defaultTtl,
            Clock clock
    ) {
        this.sessionRepository = sessionRepository;
        this.policyResolver = policyResolver;
        this.tokenGenerator = tokenGenerator;
        this.dailyCounterService = dailyCounterService;
        this.eventSink = eventSink;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.defaultTtl = defaultTtl;
        this.clock = clock;
    }

    public IssuedSession issueOrReuse(IssueSessionCommand command) {
        UUID userId = command.userId();
        String hashedIp = normalize(command.hashedIp(), Integer.MAX_VALUE);
        String deviceId = normalize(command.deviceId(), DEVICE_ID_MAX_LENGTH);
        Duration ttl = command.ttl() != null && !command.ttl().isNegative() && !command.ttl().isZero()
                ? command.ttl()
                : defaultTtl;
        int limit = policyResolver.resolveDailyLimit(userId);

        IssuedSession issued;
        try {
            issued = transactionTemplate.execute(status -> issueInTransaction(userId, hashedIp, deviceId, ttl, limit));
        } catch (DataIntegrityViolationException ex) {
            if (!QuotaSessionConstraints.isCanonicalConflict(ex)) {
                throw ex;
            }
            log.warn("Concurrent issuance for user={} ip={}, re-reading canonical session", userId, abbreviateIp(hashedIp));
            issued = rereadCanonical(userId, hashedIp, limit).orElseThrow(() -> ex);
        } catch (ConcurrencyFailureException ex) {
            log.warn("Canonical session for user={} changed concurrently, re-reading", userId);
            issued = rereadCanonical(userId, hashedIp, limit).orElseThrow(() -> ex);
        }

        dailyCounterService.recordSiteVisit();
        eventSink.publish(new QuotaEvent(
                issued.existing() ? QuotaEvent.Type.SESSION_REUSED : QuotaEvent.Type.SESSION_ISSUED,
                SessionTokenGenerator.abbreviate(issued.token()),
                userId,
                0,
                issued.limit(),
                OffsetDateTime.now(clock)
        ));
        return issued;
    }

    private IssuedSession issueInTransaction(UUID userId, String hashedIp, String deviceId, Duration ttl, int limit) {
        OffsetDateTime now = OffsetDateTime.now(clock);

        Optional<QuotaSession> canonical = findCanonical(userId, hashedIp, now);
        if (canonical.isPresent()) {
            QuotaSession session = canonical.get();
            if (Duration.between(now, session.getExpiresAt()).compareTo(ttl.dividedBy(2)) < 0) {
                session.extendExpiry(now.plus(ttl));
            }
            session.backfillDeviceId(deviceId);
            sessionRepository.saveAndFlush(session);
            return new IssuedSession(session.getToken(), limit, true, session.getExpiresAt());
        }

        retireExpiredCanonical(userId, hashedIp, now);
        QuotaSession created = new QuotaSession(tokenGenerator.generate(), userId, hashedIp, deviceId, now.plus(ttl));
        sessionRepository.saveAndFlush(created);
        log.debug("Issued session {} for user={}", SessionTokenGenerator.abbreviate(created.getToken()), userId);
        return new IssuedSession(created.getToken(), limit, false, created.getExpiresAt());
    }

    private Optional<IssuedSession> rereadCanonical(UUID userId, String hashedIp, int limit) {
        return Optional.ofNullable(transactionTemplate.execute(status ->
                findCanonical(userId, hashedIp, OffsetDateTime.now(clock))
                        .map(session -> new IssuedSession(session.getToken(), limit, true, session.getExpiresAt()))
                        .orElse(null)));
    }

    private Optional<QuotaSession> findCanonical(UUID userId, String hashedIp, OffsetDateTime now) {
        if (userId != null) {
            return sessionRepository.findLiveByUserId(userId, now);
        }
        if (hashedIp != null) {
            return sessionRepository.findLiveAnonymousByHashedIp(hashedIp, now);
        }
        return Optional.empty();
    }

    private void retireExpiredCanonical(UUID userId, String hashedIp, OffsetDateTime now) {
        int retired = 0;
        if (userId != null) {
            retired = sessionRepository.retireExpiredForUser(userId, now);
        } else if (hashedIp != null) {
            retired = sessionRepository.retireExpiredAnonymousForHashedIp(hashedIp, now);
        }
        if (retired > 0) {
            log.debug("Retired {} expired canonical session(s) for user={}", retired, userId);
        }
    }

    private static String normalize(String raw, int maxLength) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > maxLength ? trimmed.substring(0, maxLength) : trimmed;
    }

    private static String abbreviateIp(String hashedIp) {
        return hashedIp == null ? "none" : SessionTokenGenerator.abbreviate(hashedIp);
    }
}
