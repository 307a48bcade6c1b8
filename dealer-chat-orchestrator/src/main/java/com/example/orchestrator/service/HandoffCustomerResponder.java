package com.example.orchestrator.service;

import com.example.orchestrator.config.OrchestratorProperties;
import com.example.orchestrator.domain.Conversation;
import com.example.orchestrator.domain.ConversationStatus;
import com.example.orchestrator.intent.ClassificationResult;
import com.example.orchestrator.intent.MessageIntent;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Welcomes greetings and passes every other customer question to the sales team. Stays silent while
 * a human already owns the conversation and on plain acknowledgements.
 */
@Component
@RequiredArgsConstructor
public class HandoffCustomerResponder implements CustomerInquiryResponder {

    private final OrchestratorProperties properties;

    @Override
    public Optional<CustomerReply> respond(Conversation conversation, ClassificationResult classification, String text) {
        if (conversation.getStatus() == ConversationStatus.ESCALATED) {
            return Optional.empty();
        }
        MessageIntent intent = classification.intent();
        if (intent == MessageIntent.UNKNOWN || intent == MessageIntent.CUSTOMER_ACKNOWLEDGEMENT) {
            return Optional.empty();
        }
        if (intent == MessageIntent.CUSTOMER_GREETING) {
            return Optional.of(CustomerReply.reply(properties.getReplies().getWelcome()));
        }
        return Optional.of(CustomerReply.handoff(properties.getReplies().getHandoff(), intent.wireName()));
    }
}
