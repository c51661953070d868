package com.tekir.backend.modules.quota.domain;

import java.time.LocalDate;

import com.tekir.backend.global.jpa.AbstractAuditedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

/**
 * Per-device request count for one UTC day. Never reset; a new day starts a new row.
 */
@Entity
@Table(name = "device_daily_usage")
public class DeviceDailyUsage extends AbstractAuditedEntity {

    @Column(name = "usage_day", nullable = false, updatable = false)
    private LocalDate usageDay;

    @Column(name = "device_key", nullable = false, updatable = false, length = 128)
    private String deviceKey;

    @Column(name = "usage_count", nullable = false)
    private int usageCount;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected DeviceDailyUsage() {
    }

    public DeviceDailyUsage(LocalDate usageDay, String deviceKey) {
        this.usageDay = usageDay;
        this.deviceKey = deviceKey;
        this.usageCount = 0;
    }

    public LocalDate getUsageDay() {
        return usageDay;
    }

    public String getDeviceKey() {
        return deviceKey;
    }

    public int getUsageCount() {
        return usageCount;
    }

    public long getVersion() {
        return version;
    }

    public void increment() {
        this.usageCount++;
    }
}
