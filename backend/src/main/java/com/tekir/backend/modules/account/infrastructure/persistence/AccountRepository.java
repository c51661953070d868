package com.tekir.backend.modules.account.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.tekir.backend.modules.account.domain.Account;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccountRepository extends JpaRepository<Account, UUID> {

    @Query("""
            select ar.roleCode
              from AccountRole ar
             where ar.account.id = :accountId
               and ar.revokedAt is null
            """)
    List<String> findActiveRoleCodes(@Param("accountId") UUID accountId);

    @Query("""
            select case when count(ar) > 0 then true else false end
              from AccountRole ar
             where ar.account.id = :accountId
               and ar.revokedAt is null
               and upper(ar.roleCode) = 'ADMIN'
            """)
    boolean existsActiveAdminRole(@Param("accountId") UUID accountId);
}
