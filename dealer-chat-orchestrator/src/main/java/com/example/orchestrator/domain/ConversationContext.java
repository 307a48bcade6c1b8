package com.example.orchestrator.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.io.Serializable;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Typed per-conversation context, persisted as JSON next to the conversation row.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConversationContext implements Serializable {

    public static final String VERIFIED_VIA_VERIFY_COMMAND = "verify_command";

    /** Canonical phone of the staff member behind an alias identifier. */
    private String verifiedStaffPhone;

    /** Canonical alias identifiers that resolve to {@link #verifiedStaffPhone}. */
    @Builder.Default
    private Set<String> linkedLids = new LinkedHashSet<>();

    private String originalLid;

    private String closingMessage;

    private Instant verifiedAt;

    private String verifiedVia;

    public static ConversationContext empty() {
        return new ConversationContext();
    }

    public ConversationContext copy() {
        return toBuilder().linkedLids(new LinkedHashSet<>(linkedLids != null ? linkedLids : Set.of())).build();
    }

    public boolean hasLinkedLid(String lid) {
        return lid != null && linkedLids != null && linkedLids.contains(lid);
    }
}
