package com.tekir.backend.modules.account.domain;

import java.time.OffsetDateTime;

import com.tekir.backend.global.jpa.AbstractAuditedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * Role grant on an account. Subscription webhooks grant and revoke {@code paid}; a revoked row stays for history.
 */
@Entity
@Table(name = "account_role")
public class AccountRole extends AbstractAuditedEntity {

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "account_id", nullable = false)
    private Account account;

    @Column(name = "role_code", nullable = false, length = 32)
    private String roleCode;

    @Column(name = "granted_at", nullable = false)
    private OffsetDateTime grantedAt;

    @Column(name = "revoked_at")
    private OffsetDateTime revokedAt;

    protected AccountRole() {
    }

    public AccountRole(Account account, String roleCode, OffsetDateTime grantedAt) {
        this.account = account;
        this.roleCode = roleCode;
        this.grantedAt = grantedAt;
    }

    public Account getAccount() {
        return account;
    }

    public String getRoleCode() {
        return roleCode;
    }

    public OffsetDateTime getGrantedAt() {
        return grantedAt;
    }

    public OffsetDateTime getRevokedAt() {
        return revokedAt;
    }

    public void setRevokedAt(OffsetDateTime revokedAt) {
        this.revokedAt = revokedAt;
    }

    public boolean isActive() {
        return revokedAt == null;
    }
}
