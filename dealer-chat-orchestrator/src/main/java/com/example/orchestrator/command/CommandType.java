package com.example.orchestrator.command;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum CommandType {
    REPORT,
    STATUS,
    INVENTORY,
    STATS,
    EDIT,
    UPLOAD,
    HELP,
    VERIFY,
    UNKNOWN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
