package com.example.orchestrator.service;

import com.example.orchestrator.domain.Conversation;
import com.example.orchestrator.domain.ConversationMessage;
import com.example.orchestrator.domain.DeliveryStatus;
import com.example.orchestrator.domain.MessageDirection;
import com.example.orchestrator.event.MessageRecordedEvent;
import com.example.orchestrator.event.OrchestratorEventPublisher;
import com.example.orchestrator.gateway.GatewayAdapter;
import com.example.orchestrator.gateway.GatewaySendResult;
import java.time.Instant;
import java.util.Base64;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Sends a reply into a conversation and records it, as {@code SENT} or {@code FAILED}, in the
 * conversation history. Delivery failures are logged and never thrown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReplySender {

    private final GatewayAdapter gatewayAdapter;
    private final ConversationRepository conversationRepository;
    private final OrchestratorEventPublisher eventPublisher;

    public ConversationMessage sendText(Conversation conversation, String clientId, String to, String text, String intent) {
        return deliver(conversation, clientId, text, intent,
                () -> gatewayAdapter.sendText(clientId, to, text));
    }

    public ConversationMessage sendDocument(
            Conversation conversation, String clientId, String to, byte[] document, String filename, String caption) {
        String base64 = Base64.getEncoder().encodeToString(document);
        return deliver(conversation, clientId, "[document] " + filename, null,
                () -> gatewayAdapter.sendDocument(clientId, to, base64, filename, caption));
    }

    private ConversationMessage deliver(
            Conversation conversation, String clientId, String content, String intent, Supplier<GatewaySendResult> send) {
        DeliveryStatus status;
        String gatewayMessageId = null;
        try {
            gatewayMessageId = send.get().messageId();
            status = DeliveryStatus.SENT;
        } catch (RuntimeException ex) {
            log.warn("Reply to {} in conversation {} failed: {}",
                    conversation.getCustomerPhone(), conversation.getId(), ex.getMessage());
            status = DeliveryStatus.FAILED;
        }

        Instant now = Instant.now();
        ConversationMessage message = ConversationMessage.builder()
                .id(UUID.randomUUID().toString())
                .conversationId(conversation.getId())
                .direction(MessageDirection.OUTBOUND)
                .sender(clientId)
                .content(content)
                .intent(intent)
                .deliveryStatus(status)
                .gatewayMessageId(gatewayMessageId)
                .timestamp(now)
                .build();
        conversationRepository.appendMessage(message);

        eventPublisher.publishMessageEvent(MessageRecordedEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .tenantId(conversation.getTenantId())
                .conversationId(conversation.getId())
                .message(message)
                .occurredAt(now)
                .build());
        return message;
    }
}
