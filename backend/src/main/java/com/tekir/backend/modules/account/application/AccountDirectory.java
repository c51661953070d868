package com.tekir.backend.modules.account.application;

import java.util.Set;
import java.util.UUID;

/**
 * Read-only view of account roles.
 * Implementations may throw any runtime exception when the backing store is unreachable.
 */
public interface AccountDirectory {

    /**
     * @return active role codes as stored (case preserved); empty for an unknown account
     */
    Set<String> findActiveRoles(UUID accountId);

    boolean isAdmin(UUID accountId);
}
