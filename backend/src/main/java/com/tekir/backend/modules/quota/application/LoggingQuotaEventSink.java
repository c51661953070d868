package com.tekir.backend.modules.quota.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

@Component
public class LoggingQuotaEventSink implements QuotaEventSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingQuotaEventSink.class);

    @Async
    @Override
    public void publish(QuotaEvent event) {
        log.info("quota-event type={} token={} user={} count={} limit={} at={}",
                event.type(),
                event.tokenPrefix(),
                event.userId(),
                event.currentCount(),
                event.limit(),
                event.occurredAt());
    }
}
