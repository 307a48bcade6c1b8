package com.example.orchestrator.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Dealership roles with their numeric access level. Higher levels include the rights of lower ones.
 */
public enum StaffRole {
    SALES(30),
    STAFF(30),
    MANAGER(30),
    ADMIN(90),
    OWNER(100),
    SUPER_ADMIN(110);

    public static final int OPERATIONAL_LEVEL = 30;
    public static final int REPORT_LEVEL = 90;

    private final int level;

    StaffRole(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    public static Optional<StaffRole> fromName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (StaffRole role : values()) {
            if (role.name().equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
