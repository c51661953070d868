package com.tekir.backend.modules.quota.application;

/**
 * @param token   token the client should use from now on
 * @param changed true when it differs from the presented token
 */
public record LinkedSession(String token, boolean changed, int limit) {
}
