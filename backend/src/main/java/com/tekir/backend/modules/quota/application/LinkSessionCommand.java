package com.tekir.backend.modules.quota.application;

import java.util.UUID;

/**
 * @param token    session token presented by the client
 * @param userId   account the session should belong to
 * @param callerId authenticated account making the request
 */
public record LinkSessionCommand(String token, UUID userId, UUID callerId) {
}
