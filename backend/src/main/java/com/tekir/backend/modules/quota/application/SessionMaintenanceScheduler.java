package com.tekir.backend.modules.quota.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SessionMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionMaintenanceScheduler.class);

    private final SessionJanitor sessionJanitor;
    private final int resetMaxPasses;

    public SessionMaintenanceScheduler(
            SessionJanitor sessionJanitor,
            @Value("${tekir.janitor.reset-max-passes:10}") int resetMaxPasses
    ) {
        this.sessionJanitor = sessionJanitor;
        this.resetMaxPasses = Math.max(1, resetMaxPasses);
    }

    @Scheduled(cron = "${tekir.janitor.reset-cron:0 5 0 * * *}", zone = "UTC")
    public void resetDailyCounts() {
        int passes = 0;
        SweepResult result;
        do {
            result = sessionJanitor.resetDailyCounts();
            passes++;
        } while (result.hasMore() && passes < resetMaxPasses);

        if (result.hasMore()) {
            log.warn("Daily reset stopped after {} passes with work remaining", passes);
        }
    }

    @Scheduled(
            fixedDelayString = "${tekir.janitor.expiry-interval:PT1H}",
            initialDelayString = "${tekir.janitor.expiry-initial-delay:PT1M}"
    )
    public void sweepExpiredSessions() {
        SweepResult result = sessionJanitor.sweepExpiredSessions();
        if (result.hasMore()) {
            log.info("Expiry sweep has more expired sessions; continuing on the next run");
        }
    }
}
