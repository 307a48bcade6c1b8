package com.example.orchestrator.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A single inbound or outbound WhatsApp message. Never modified after it is recorded.
 */
@Value
@Builder
@Jacksonized
public class ConversationMessage implements Serializable {

    String id;
    String conversationId;
    MessageDirection direction;
    String sender;
    String content;
    String intent;
    DeliveryStatus deliveryStatus;
    String gatewayMessageId;
    Instant timestamp;
}
