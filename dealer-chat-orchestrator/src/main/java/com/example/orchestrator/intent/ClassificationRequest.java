package com.example.orchestrator.intent;

import com.example.orchestrator.domain.ConversationStatus;

/**
 * @param explicitStaffContext the conversation is already established as a staff thread; outranks a fresh lookup
 * @param conversationStatus status before this message was applied, null for a new conversation
 */
public record ClassificationRequest(
        String text,
        String senderPhone,
        String tenantId,
        boolean hasMedia,
        boolean explicitStaffContext,
        ConversationStatus conversationStatus) {
}
