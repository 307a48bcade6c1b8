package com.example.orchestrator.domain;

import java.io.Serializable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.util.StringUtils;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StaffIdentity implements Serializable {

    private String id;
    /** Null for platform-wide staff. */
    private String tenantId;
    private String firstName;
    private String lastName;
    /** Phone as stored by the admin UI, not necessarily canonical. */
    private String phone;
    private StaffRole role;
    private Integer roleLevel;

    public int effectiveRoleLevel() {
        if (roleLevel != null) {
            return roleLevel;
        }
        return role != null ? role.getLevel() : 0;
    }

    public String displayName() {
        String name = ((firstName != null ? firstName : "") + " " + (lastName != null ? lastName : "")).trim();
        return StringUtils.hasText(name) ? name : "Staff";
    }
}
