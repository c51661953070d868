package com.tekir.backend.modules.quota.infrastructure.persistence;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

import com.tekir.backend.modules.quota.domain.DeviceDailyUsage;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DeviceDailyUsageRepository extends JpaRepository<DeviceDailyUsage, UUID> {

    Optional<DeviceDailyUsage> findByUsageDayAndDeviceKey(LocalDate usageDay, String deviceKey);

    @Modifying
    @Query("delete from DeviceDailyUsage u where u.usageDay < :cutoff")
    int deleteOlderThan(@Param("cutoff") LocalDate cutoff);
}
