package com.example.orchestrator.intent;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum MessageIntent {
    CUSTOMER_GREETING,
    CUSTOMER_VEHICLE_INQUIRY,
    CUSTOMER_PRICE_INQUIRY,
    CUSTOMER_TEST_DRIVE,
    CUSTOMER_INQUIRY,
    CUSTOMER_ACKNOWLEDGEMENT,
    STAFF_HELP,
    STAFF_GET_REPORT,
    STAFF_UPDATE_STATUS,
    STAFF_CHECK_INVENTORY,
    STAFF_GET_STATS,
    STAFF_EDIT_VEHICLE,
    STAFF_UPLOAD_VEHICLE,
    STAFF_VERIFY_IDENTITY,
    CLOSE_CONVERSATION,
    UNKNOWN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Operational or reporting command addressed to the dealership back office. */
    public boolean isStaffCommand() {
        return name().startsWith("STAFF_") && this != STAFF_VERIFY_IDENTITY;
    }

    public boolean isCustomerIntent() {
        return name().startsWith("CUSTOMER_");
    }
}
