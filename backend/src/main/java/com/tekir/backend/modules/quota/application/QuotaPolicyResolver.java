package com.tekir.backend.modules.quota.application;

import java.util.Set;
import java.util.UUID;

import com.tekir.backend.modules.account.application.AccountDirectory;
import com.tekir.backend.modules.quota.domain.QuotaTier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Maps an account (or its absence) to a daily request ceiling.
 * The same number caps the device-level counter.
 */
@Service
public class QuotaPolicyResolver {

    private static final Logger log = LoggerFactory.getLogger(QuotaPolicyResolver.class);

    private final AccountDirectory accountDirectory;
    private final int anonymousLimit;
    private final int authenticatedLimit;
    private final int paidLimit;
    private final String paidRole;

    public QuotaPolicyResolver(
            AccountDirectory accountDirectory,
            @Value("${tekir.quota.anonymous-daily-limit:150}") int anonymousLimit,
            @Value("${tekir.quota.authenticated-daily-limit:300}") int authenticatedLimit,
            @Value("${tekir.quota.paid-daily-limit:600}") int paidLimit,
            @Value("${tekir.quota.paid-role:paid}") String paidRole
    ) {
        this.accountDirectory = accountDirectory;
        this.anonymousLimit = anonymousLimit;
        this.authenticatedLimit = authenticatedLimit;
        this.paidLimit = paidLimit;
        this.paidRole = paidRole;
    }

    /**
     * @param userId account id, or {@code null} for an anonymous caller
     */
    public int resolveDailyLimit(UUID userId) {
        return limitFor(resolveTier(userId));
    }

    public QuotaTier resolveTier(UUID userId) {
        if (userId == null) {
            return QuotaTier.ANONYMOUS;
        }
        Set<String> roles;
        try {
            roles = accountDirectory.findActiveRoles(userId);
        } catch (RuntimeException ex) {
            log.warn("Role lookup failed for account {}, using authenticated tier: {}", userId, ex.getMessage());
            return QuotaTier.AUTHENTICATED;
        }
        boolean paid = roles != null && roles.stream().anyMatch(role -> role != null && role.equalsIgnoreCase(paidRole));
        return paid ? QuotaTier.PAID : QuotaTier.AUTHENTICATED;
    }

    public int limitFor(QuotaTier tier) {
        return switch (tier) {
            case ANONYMOUS -> anonymousLimit;
            case AUTHENTICATED -> authenticatedLimit;
            case PAID -> paidLimit;
        };
    }

    public int anonymousLimit() {
        return anonymousLimit;
    }
}
