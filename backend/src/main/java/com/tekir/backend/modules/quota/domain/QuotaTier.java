package com.tekir.backend.modules.quota.domain;

public enum QuotaTier {
    ANONYMOUS,
    AUTHENTICATED,
    PAID
}
