package com.example.orchestrator.event;

import com.example.orchestrator.domain.ConversationMessage;
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
public class MessageRecordedEvent implements Serializable {

    private String eventId;
    private String tenantId;
    private String conversationId;
    private ConversationMessage message;
    private Instant occurredAt;
}
