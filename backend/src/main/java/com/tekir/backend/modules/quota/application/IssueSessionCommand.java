package com.tekir.backend.modules.quota.application;

import java.time.Duration;
import java.util.UUID;

/**
 * @param userId   signed-in account, or null
 * @param hashedIp hashed client origin, or null
 * @param deviceId client-supplied device id, or null
 * @param ttl      requested lifetime; null uses the configured default
 */
public record IssueSessionCommand(UUID userId, String hashedIp, String deviceId, Duration ttl) {
}
