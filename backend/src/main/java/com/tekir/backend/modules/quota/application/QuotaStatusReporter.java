package com.tekir.backend.modules.quota.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

import com.tekir.backend.global.common.time.QuotaDays;
import com.tekir.backend.modules.quota.domain.DeviceDailyUsage;
import com.tekir.backend.modules.quota.domain.QuotaSession;
import com.tekir.backend.modules.quota.infrastructure.persistence.DeviceDailyUsageRepository;
import com.tekir.backend.modules.quota.infrastructure.persistence.QuotaSessionRepository;

import org.springframework.stereotype.Service;

/**
 * Read-only quota snapshot for display. Never mutates counters.
 */
@Service
public class QuotaStatusReporter {

    private final QuotaSessionRepository sessionRepository;
    private final DeviceDailyUsageRepository deviceUsageRepository;
    private final QuotaPolicyResolver policyResolver;
    private final Clock clock;

    public QuotaStatusReporter(
            QuotaSessionRepository sessionRepository,
            DeviceDailyUsageRepository deviceUsageRepository,
            QuotaPolicyResolver policyResolver,
            Clock clock
    ) {
        this.sessionRepository = sessionRepository;
        this.deviceUsageRepository = deviceUsageRepository;
        this.policyResolver = policyResolver;
        this.clock = clock;
    }

    public QuotaStatus status(String token) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime resetTime = QuotaDays.nextReset(clock);

        Optional<QuotaSession> found = token == null || token.isBlank()
                ? Optional.empty()
                : sessionRepository.findByToken(token.trim());
        if (found.isEmpty() || !found.get().isLiveAt(now)) {
            int count = found.map(QuotaSession::getRequestCount).orElse(0);
            return new QuotaStatus(false, count, policyResolver.anonymousLimit(), 0, false, resetTime);
        }

        QuotaSession session = found.get();
        int ceiling = policyResolver.resolveDailyLimit(session.getUserId());
        String deviceKey = session.deviceKey();
        int deviceCount = deviceKey == null
                ? 0
                : deviceUsageRepository.findByUsageDayAndDeviceKey(QuotaDays.today(clock), deviceKey)
                        .map(DeviceDailyUsage::getUsageCount)
                        .orElse(0);
        int remaining = QuotaEnforcer.remaining(ceiling, session.getRequestCount(), deviceKey, deviceCount);

        return new QuotaStatus(true, session.getRequestCount(), ceiling, remaining, !session.isAnonymous(), resetTime);
    }
}
