package com.tekir.backend.modules.quota.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.tekir.backend.global.common.time.QuotaDays;
import com.tekir.backend.global.error.ProblemException;
import com.tekir.backend.modules.account.application.AccountDirectory;
import com.tekir.backend.modules.quota.infrastructure.persistence.DeviceDailyUsageRepository;
import com.tekir.backend.modules.quota.infrastructure.persistence.QuotaSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Bounded maintenance sweeps. Each call does a fixed amount of work and reports whether more remains.
 */
@Service
public class SessionJanitor {

    private static final Logger log = LoggerFactory.getLogger(SessionJanitor.class);

    private final QuotaSessionRepository sessionRepository;
    private final DeviceDailyUsageRepository deviceUsageRepository;
    private final AccountDirectory accountDirectory;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final int expiryBatchSize;
    private final int resetBatchSize;
    private final int resetMaxBatches;
    private final int deviceUsageRetentionDays;

    public SessionJanitor(
            QuotaSessionRepository sessionRepository,
            DeviceDailyUsageRepository deviceUsageRepository,
            AccountDirectory accountDirectory,
            PlatformTransactionManager transactionManager,
            Clock clock,
            @Value("${tekir.janitor.expiry-batch-size:100}") int expiryBatchSize,
            @Value("${tekir.janitor.reset-batch-size:50}") int resetBatchSize,
            @Value("${tekir.janitor.reset-max-batches:20}") int resetMaxBatches,
            @Value("${tekir.janitor.device-usage-retention-days:7}") int deviceUsageRetentionDays
    ) {
        this.sessionRepository = sessionRepository;
        this.deviceUsageRepository = deviceUsageRepository;
        this.accountDirectory = accountDirectory;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.expiryBatchSize = Math.max(1, expiryBatchSize);
        this.resetBatchSize = Math.max(1, resetBatchSize);
        this.resetMaxBatches = Math.max(1, resetMaxBatches);
        this.deviceUsageRetentionDays = Math.max(1, deviceUsageRetentionDays);
    }

    /**
     * Deletes up to one batch of expired sessions, each in its own transaction.
     * A row that fails to delete is skipped and left for the next run.
     */
    public SweepResult sweepExpiredSessions() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<UUID> expiredIds = sessionRepository.findExpiredIds(now, PageRequest.of(0, expiryBatchSize));

        int deleted = 0;
        int failed = 0;
        for (UUID id : expiredIds) {
            try {
                Integer removed = transactionTemplate.execute(status -> sessionRepository.deleteExpiredById(id, now));
                deleted += removed == null ? 0 : removed;
            } catch (DataAccessException ex) {
                failed++;
                log.warn("Failed to delete expired session {}: {}", id, ex.getMessage());
            }
        }

        purgeOldDeviceUsage();

        boolean hasMore = expiredIds.size() == expiryBatchSize;
        if (!expiredIds.isEmpty()) {
            log.info("Expiry sweep deleted={} failed={} hasMore={}", deleted, failed, hasMore);
        }
        return new SweepResult(deleted, failed, hasMore);
    }

    /**
     * Zeroes request counts of live sessions, at most {@code reset-max-batches} batches per call.
     */
    public SweepResult resetDailyCounts() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int reset = 0;
        int batches = 0;
        boolean lastBatchFull = false;

        while (batches < resetMaxBatches) {
            List<UUID> ids = sessionRepository.findResettableIds(now, PageRequest.of(0, resetBatchSize));
            if (ids.isEmpty()) {
                lastBatchFull = false;
                break;
            }
            Integer updated = transactionTemplate.execute(status -> sessionRepository.resetRequestCounts(ids, now));
            reset += updated == null ? 0 : updated;
            batches++;
            lastBatchFull = ids.size() == resetBatchSize;
            if (!lastBatchFull) {
                break;
            }
        }

        boolean hasMore = batches == resetMaxBatches && lastBatchFull;
        log.info("Daily reset zeroed={} batches={} hasMore={}", reset, batches, hasMore);
        return new SweepResult(reset, 0, hasMore);
    }

    public SweepResult resetDailyCountsAsAdmin(UUID callerId) {
        requireAdmin(callerId);
        return resetDailyCounts();
    }

    public SweepResult sweepExpiredSessionsAsAdmin(UUID callerId) {
        requireAdmin(callerId);
        return sweepExpiredSessions();
    }

    private void requireAdmin(UUID callerId) {
        if (callerId == null || !accountDirectory.isAdmin(callerId)) {
            throw ProblemException.forbidden("ADMIN_REQUIRED", "Administrator role required");
        }
    }

    private void purgeOldDeviceUsage() {
        try {
            Integer purged = transactionTemplate.execute(status ->
                    deviceUsageRepository.deleteOlderThan(QuotaDays.today(clock).minusDays(deviceUsageRetentionDays)));
            if (purged != null && purged > 0) {
                log.info("Purged {} device usage rows older than {} days", purged, deviceUsageRetentionDays);
            }
        } catch (DataAccessException ex) {
            log.warn("Device usage purge failed: {}", ex.getMessage());
        }
    }
}
