package com.tekir.backend.modules.account.domain;

import java.util.ArrayList;
import java.util.List;

import com.tekir.backend.global.jpa.AbstractAuditedEntity;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.OneToMany;
import jakarta.persistence.Table;

/**
 * Signed-in user account. Only the role set matters to quota decisions.
 */
@Entity
@Table(name = "account")
public class Account extends AbstractAuditedEntity {

    @Column(name = "email", nullable = false, length = 320)
    private String email;

    @Column(name = "display_name", length = 100)
    private String displayName;

    @OneToMany(mappedBy = "account", cascade = CascadeType.ALL, fetch = FetchType.LAZY, orphanRemoval = false)
    private List<AccountRole> roles = new ArrayList<>();

    protected Account() {
    }

    public Account(String email, String displayName) {
        this.email = email;
        this.displayName = displayName;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public List<AccountRole> getRoles() {
        return roles;
    }
}
