package com.example.orchestrator.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Conversation implements Serializable {

    private String id;
    private String tenantId;
    /** Canonical digits of the remote party, unique per tenant. */
    private String customerPhone;
    private boolean staff;
    private ConversationType conversationType;
    private ConversationStatus status;
    private Instant escalatedAt;
    private Instant closedAt;
    private Instant createdAt;
    private Instant lastMessageAt;
    private ConversationContext context;
    private Long version;

    public ConversationContext contextOrEmpty() {
        return context != null ? context : ConversationContext.empty();
    }
}
