package com.tekir.backend.modules.quota.application;

/**
 * Result of one consume attempt.
 *
 * @param currentCount session count after the attempt (committed value on a conflict re-read)
 * @param incremented  whether this call's increment was committed
 */
public record QuotaDecision(
        boolean allowed,
        int currentCount,
        int limit,
        int remaining,
        boolean incremented,
        Outcome outcome
) {

    public enum Outcome {
        ALLOWED,
        SESSION_LIMIT_REACHED,
        DEVICE_LIMIT_REACHED,
        UNKNOWN_SESSION,
        EXPIRED_SESSION,
        CONFLICT_REREAD
    }

    /**
     * True when the session itself is unusable, as opposed to being over quota.
     */
    public boolean sessionInvalid() {
        return outcome == Outcome.UNKNOWN_SESSION || outcome == Outcome.EXPIRED_SESSION;
    }
}
