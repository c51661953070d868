package com.tekir.backend.modules.quota.domain;

public enum DailyCounterKind {
    API_HIT,
    SITE_VISIT
}
