package com.tekir.backend.modules.quota.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.tekir.backend.global.jpa.AbstractAuditedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

/**
 * Quota-bearing session identity. The token never changes after creation;
 * {@code version} makes concurrent increments and promotions conflict instead of overwrite.
 */
@Entity
@Table(name = "quota_session")
public class QuotaSession extends AbstractAuditedEntity {

    @Column(name = "token", nullable = false, updatable = false, length = 128)
    private String token;

    @Column(name = "hashed_ip", length = 128)
    private String hashedIp;

    @Column(name = "device_id", length = 100)
    private String deviceId;

    @Column(name = "user_id", columnDefinition = "uuid")
    private UUID userId;

    @Column(name = "request_count", nullable = false)
    private int requestCount;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected QuotaSession() {
    }

    public QuotaSession(String token, UUID userId, String hashedIp, String deviceId, OffsetDateTime expiresAt) {
        this.token = token;
        this.userId = userId;
        this.hashedIp = hashedIp;
        this.deviceId = deviceId;
        this.expiresAt = expiresAt;
        this.requestCount = 0;
        this.active = true;
    }

    public String getToken() {
        return token;
    }

    public String getHashedIp() {
        return hashedIp;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public UUID getUserId() {
        return userId;
    }

    public int getRequestCount() {
        return requestCount;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public boolean isActive() {
        return active;
    }

    public long getVersion() {
        return version;
    }

    public boolean isAnonymous() {
        return userId == null;
    }

    public boolean isExpiredAt(OffsetDateTime now) {
        return !expiresAt.isAfter(now);
    }

    public boolean isLiveAt(OffsetDateTime now) {
        return active && !isExpiredAt(now);
    }

    /**
     * Device id wins over the hashed origin; null when neither is known.
     */
    public String deviceKey() {
        if (deviceId != null && !deviceId.isBlank()) {
            return deviceId;
        }
        return hashedIp;
    }

    /**
     * Moves expiry forward; an earlier instant is ignored.
     */
    public boolean extendExpiry(OffsetDateTime candidate) {
        if (candidate != null && candidate.isAfter(expiresAt)) {
            this.expiresAt = candidate;
            return true;
        }
        return false;
    }

    /**
     * Fills the device id only when none is recorded yet.
     */
    public boolean backfillDeviceId(String candidate) {
        if ((deviceId == null || deviceId.isBlank()) && candidate != null && !candidate.isBlank()) {
            this.deviceId = candidate;
            return true;
        }
        return false;
    }

    public void attachUser(UUID userId) {
        if (this.userId != null && !this.userId.equals(userId)) {
            throw new IllegalStateException("Session already belongs to another account");
        }
        this.userId = userId;
    }

    public void deactivate() {
        this.active = false;
    }

    public void incrementRequestCount() {
        this.requestCount++;
    }
}
