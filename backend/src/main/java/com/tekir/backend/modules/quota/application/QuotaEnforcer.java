package com.tekir.backend.modules.quota.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Optional;

import com.tekir.backend.global.common.time.QuotaDays;
import com.tekir.backend.modules.quota.application.QuotaDecision.Outcome;
import com.tekir.backend.modules.quota.domain.DeviceDailyUsage;
import com.tekir.backend.modules.quota.domain.QuotaSession;
import com.tekir.backend.modules.quota.infrastructure.persistence.DeviceDailyUsageRepository;
import com.tekir.backend.modules.quota.infrastructure.persistence.QuotaSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Atomic check-and-increment against both the session counter and today's device counter.
 * Either both counters move or neither does. A lost optimistic race is not retried: the
 * committed count is re-read and the answer derived from it.
 */
@Service
public class QuotaEnforcer {

    private static final Logger log = LoggerFactory.getLogger(QuotaEnforcer.class);

    private final QuotaSessionRepository sessionRepository;
    private final DeviceDailyUsageRepository deviceUsageRepository;
    private final QuotaPolicyResolver policyResolver;
    private final DailyCounterService dailyCounterService;
    private final QuotaEventSink eventSink;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public QuotaEnforcer(
            QuotaSessionRepository sessionRepository,
            DeviceDailyUsageRepository deviceUsageRepository,
            QuotaPolicyResolver policyResolver,
            DailyCounterService dailyCounterService,
            QuotaEventSink eventSink,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.sessionRepository = sessionRepository;
        this.deviceUsageRepository = deviceUsageRepository;
        this.policyResolver = policyResolver;
        this.dailyCounterService = dailyCounterService;
        this.eventSink = eventSink;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public QuotaDecision consume(String token) {
        if (token == null || token.isBlank()) {
            return unknown();
        }
        Optional<QuotaSession> snapshot = sessionRepository.findByToken(token.trim());
        if (snapshot.isEmpty()) {
            return unknown();
        }
        QuotaSession observed = snapshot.get();
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (!observed.isLiveAt(now)) {
            return expired(observed);
        }

        int ceiling = policyResolver.resolveDailyLimit(observed.getUserId());

        QuotaDecision decision;
        try {
            decision = transactionTemplate.execute(status -> attempt(observed, ceiling));
        } catch (ConcurrencyFailureException | DataIntegrityViolationException ex) {
            decision = rereadAfterConflict(observed, ceiling, ex);
        }

        publish(decision, observed);
        return decision;
    }

    private QuotaDecision attempt(QuotaSession observed, int ceiling) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        QuotaSession session = sessionRepository.findById(observed.getId()).orElse(null);
        if (session == null) {
            return unknown();
        }
        if (!session.isLiveAt(now)) {
            return expired(session);
        }

        LocalDate today = QuotaDays.today(clock);
        String deviceKey = session.deviceKey();
        DeviceDailyUsage usage = deviceKey == null
                ? null
                : deviceUsageRepository.findByUsageDayAndDeviceKey(today, deviceKey).orElse(null);
        int deviceCount = usage == null ? 0 : usage.getUsageCount();
        int sessionCount = session.getRequestCount();

        if (sessionCount + 1 > ceiling) {
            return denied(sessionCount, deviceKey, deviceCount, ceiling, Outcome.SESSION_LIMIT_REACHED);
        }
        if (deviceKey != null && deviceCount + 1 > ceiling) {
            return denied(sessionCount, deviceKey, deviceCount, ceiling, Outcome.DEVICE_LIMIT_REACHED);
        }

        session.incrementRequestCount();
        sessionRepository.saveAndFlush(session);
        if (deviceKey != null) {
            DeviceDailyUsage row = usage != null ? usage : new DeviceDailyUsage(today, deviceKey);
            row.increment();
            deviceUsageRepository.saveAndFlush(row);
            deviceCount = row.getUsageCount();
        }

        int remaining = remaining(ceiling, session.getRequestCount(), deviceKey, deviceCount);
        return new QuotaDecision(true, session.getRequestCount(), ceiling, remaining, true, Outcome.ALLOWED);
    }

    private QuotaDecision rereadAfterConflict(QuotaSession observed, int ceiling, DataAccessException cause) {
        log.warn("Quota update for session {} lost a concurrent race ({}), re-reading committed count",
                SessionTokenGenerator.abbreviate(observed.getToken()), cause.getClass().getSimpleName());
        QuotaSession committed = sessionRepository.findById(observed.getId()).orElse(null);
        if (committed == null) {
            return unknown();
        }
        if (!committed.isLiveAt(OffsetDateTime.now(clock))) {
            return expired(committed);
        }

        String deviceKey = committed.deviceKey();
        int deviceCount = deviceKey == null
                ? 0
                : deviceUsageRepository.findByUsageDayAndDeviceKey(QuotaDays.today(clock), deviceKey)
                        .map(DeviceDailyUsage::getUsageCount)
                        .orElse(0);
        int sessionCount = committed.getRequestCount();
        boolean allowed = sessionCount < ceiling && (deviceKey == null || deviceCount < ceiling);
        return new QuotaDecision(allowed, sessionCount, ceiling, remaining(ceiling, sessionCount, deviceKey, deviceCount),
                false, Outcome.CONFLICT_REREAD);
    }

    private QuotaDecision denied(int sessionCount, String deviceKey, int deviceCount, int ceiling, Outcome outcome) {
        log.debug("Quota denied ({}) at session count {} / device count {} of {}", outcome, sessionCount, deviceCount, ceiling);
        return new QuotaDecision(false, sessionCount, ceiling, remaining(ceiling, sessionCount, deviceKey, deviceCount),
                false, outcome);
    }

    private QuotaDecision unknown() {
        return new QuotaDecision(false, 0, policyResolver.anonymousLimit(), 0, false, Outcome.UNKNOWN_SESSION);
    }

    private QuotaDecision expired(QuotaSession session) {
        return new QuotaDecision(false, session.getRequestCount(), policyResolver.anonymousLimit(), 0, false,
                Outcome.EXPIRED_SESSION);
    }

    private void publish(QuotaDecision decision, QuotaSession observed) {
        if (decision.incremented()) {
            dailyCounterService.recordApiHit();
        }
        QuotaEvent.Type type = switch (decision.outcome()) {
            case ALLOWED -> QuotaEvent.Type.REQUEST_ALLOWED;
            case CONFLICT_REREAD -> QuotaEvent.Type.CONFLICT_REREAD;
            default -> QuotaEvent.Type.REQUEST_DENIED;
        };
        eventSink.publish(new QuotaEvent(
                type,
                SessionTokenGenerator.abbreviate(observed.getToken()),
                observed.getUserId(),
                decision.currentCount(),
                decision.limit(),
                OffsetDateTime.now(clock)
        ));
    }

    static int remaining(int ceiling, int sessionCount, String deviceKey, int deviceCount) {
        int sessionRemaining = ceiling - sessionCount;
        int deviceRemaining = deviceKey == null ? Integer.MAX_VALUE : ceiling - deviceCount;
        return Math.max(0, Math.min(sessionRemaining, deviceRemaining));
    }
}
