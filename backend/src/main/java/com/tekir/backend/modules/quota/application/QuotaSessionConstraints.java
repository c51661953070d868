package com.tekir.backend.modules.quota.application;

import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;

final class QuotaSessionConstraints {

    static final String CANONICAL_USER = "uq_quota_session_canonical_user";
    static final String CANONICAL_IP = "uq_quota_session_canonical_ip";
    static final String DEVICE_DAY = "uq_device_daily_usage_day_key";

    private QuotaSessionConstraints() {
    }

    static boolean isCanonicalConflict(DataIntegrityViolationException ex) {
        return violates(ex, CANONICAL_USER) || violates(ex, CANONICAL_IP);
    }

    static boolean violates(DataIntegrityViolationException ex, String constraintName) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && message.contains(constraintName);
    }
}
