package com.tekir.backend.modules.quota.application;

/**
 * Fire-and-forget receiver of quota events. Implementations must not block the caller
 * and must not let failures reach it.
 */
public interface QuotaEventSink {

    void publish(QuotaEvent event);
}
