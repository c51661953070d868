package com.tekir.backend.global.error;

import java.time.Duration;

import org.springframework.http.HttpStatus;

/**
 * Problem the client may retry later; rendered with a Retry-After header in whole seconds, never below one.
 */
public class RetryableProblemException extends ProblemException {

    private final Duration retryAfter;

    public RetryableProblemException(HttpStatus status, String code, String detail, Duration retryAfter) {
        super(status, code, detail);
        if (retryAfter == null || retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must be a non-negative duration");
        }
        this.retryAfter = retryAfter;
    }

    public static RetryableProblemException tooManyRequests(String code, String detail, Duration retryAfter) {
        return new RetryableProblemException(HttpStatus.TOO_MANY_REQUESTS, code, detail, retryAfter);
    }

    public long getRetryAfterSeconds() {
        long seconds = retryAfter.getSeconds() + (retryAfter.getNano() > 0 ? 1 : 0);
        return Math.max(seconds, 1L);
    }
}
