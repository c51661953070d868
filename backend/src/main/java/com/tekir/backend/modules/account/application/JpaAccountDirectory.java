package com.tekir.backend.modules.account.application;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

import com.tekir.backend.modules.account.infrastructure.persistence.AccountRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class JpaAccountDirectory implements AccountDirectory {

    private final AccountRepository accountRepository;

    public JpaAccountDirectory(AccountRepository accountRepository) {
        this.accountRepository = accountRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Set<String> findActiveRoles(UUID accountId) {
        return new LinkedHashSet<>(accountRepository.findActiveRoleCodes(accountId));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isAdmin(UUID accountId) {
        return accountRepository.existsActiveAdminRole(accountId);
    }
}
