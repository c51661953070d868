package com.tekir.backend.modules.quota.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.tekir.backend.modules.quota.domain.QuotaSession;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface QuotaSessionRepository extends JpaRepository<QuotaSession, UUID> {

    Optional<QuotaSession> findByToken(String token);

    @Query("""
            select s
              from QuotaSession s
             where s.userId = :userId
               and s.active = true
               and s.expiresAt > :now
            """)
    Optional<QuotaSession> findLiveByUserId(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);

    @Query("""
            select s
              from QuotaSession s
             where s.hashedIp = :hashedIp
               and s.userId is null
               and s.active = true
               and s.expiresAt > :now
            """)
    Optional<QuotaSession> findLiveAnonymousByHashedIp(@Param("hashedIp") String hashedIp,
                                                       @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update QuotaSession s
               set s.active = false,
                   s.version = s.version + 1,
                   s.updatedAt = :now
             where s.userId = :userId
               and s.active = true
               and s.expiresAt <= :now
            """)
    int retireExpiredForUser(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update QuotaSession s
               set s.active = false,
                   s.version = s.version + 1,
                   s.updatedAt = :now
             where s.hashedIp = :hashedIp
               and s.userId is null
               and s.active = true
               and s.expiresAt <= :now
            """)
    int retireExpiredAnonymousForHashedIp(@Param("hashedIp") String hashedIp, @Param("now") OffsetDateTime now);

    @Query("""
            select s.id
              from QuotaSession s
             where s.expiresAt < :now
             order by s.expiresAt asc
            """)
    List<UUID> findExpiredIds(@Param("now") OffsetDateTime now, Pageable pageable);

    @Modifying
    @Query("""
            delete from QuotaSession s
             where s.id = :id
               and s.expiresAt < :now
            """)
    int deleteExpiredById(@Param("id") UUID id, @Param("now") OffsetDateTime now);

    @Query("""
            select s.id
              from QuotaSession s
             where s.active = true
               and s.expiresAt > :now
               and s.requestCount > 0
             order by s.id asc
            """)
    List<UUID> findResettableIds(@Param("now") OffsetDateTime now, Pageable pageable);

    @Modifying(clearAutomatically = true)
    @Query("""
            update QuotaSession s
               set s.requestCount = 0,
                   s.version = s.version + 1,
                   s.updatedAt = :now
             where s.id in :ids
               and s.requestCount > 0
            """)
    int resetRequestCounts(@Param("ids") Collection<UUID> ids, @Param("now") OffsetDateTime now);
}
