package com.tekir.backend.modules.quota.application;

import java.time.Clock;

import com.tekir.backend.global.common.time.QuotaDays;
import com.tekir.backend.modules.quota.domain.DailyCounterKind;
import com.tekir.backend.modules.quota.infrastructure.persistence.DailyCounterRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Site-wide daily counters. Best effort: a failed write is logged and never reaches the request.
 */
@Service
public class DailyCounterService {

    private static final Logger log = LoggerFactory.getLogger(DailyCounterService.class);

    private final DailyCounterRepository dailyCounterRepository;
    private final Clock clock;

    public DailyCounterService(DailyCounterRepository dailyCounterRepository, Clock clock) {
        this.dailyCounterRepository = dailyCounterRepository;
        this.clock = clock;
    }

    @Async
    public void recordApiHit() {
        record(DailyCounterKind.API_HIT);
    }

    @Async
    public void recordSiteVisit() {
        record(DailyCounterKind.SITE_VISIT);
    }

    void record(DailyCounterKind kind) {
        try {
            dailyCounterRepository.increment(QuotaDays.today(clock), kind);
        } catch (DataAccessException ex) {
            log.warn("Failed to bump {} counter: {}", kind, ex.getMessage());
        }
    }
}
