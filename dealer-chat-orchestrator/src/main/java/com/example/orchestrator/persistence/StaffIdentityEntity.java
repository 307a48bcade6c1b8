package com.example.orchestrator.persistence;

import com.example.orchestrator.domain.StaffRole;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

/**
 * Read model over the platform's user table. The orchestrator never writes staff rows.
 */
@Getter
@Setter
@Entity
@Table(name = "staff_identities", indexes = @Index(name = "idx_staff_identities_tenant", columnList = "tenant_id"))
public class StaffIdentityEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "tenant_id", length = 64)
    private String tenantId;

    @Column(name = "first_name", length = 128)
    private String firstName;

    @Column(name = "last_name", length = 128)
    private String lastName;

    @Column(name = "phone", length = 32)
    private String phone;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 32)
    private StaffRole role;

    @Column(name = "role_level")
    private Integer roleLevel;

    @Column(name = "active", nullable = false)
    private boolean active = true;
}
