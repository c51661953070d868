package com.tekir.backend.modules.quota.presentation;

/**
 * @param hashedIp hex SHA-256 of the client address, or null when it cannot be determined
 * @param deviceId client-supplied device id, or null
 */
public record ClientFingerprint(String hashedIp, String deviceId) {
}
