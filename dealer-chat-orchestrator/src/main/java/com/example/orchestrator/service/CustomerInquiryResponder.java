package com.example.orchestrator.service;

import com.example.orchestrator.domain.Conversation;
import com.example.orchestrator.intent.ClassificationResult;
import java.util.Optional;

/**
 * Produces the automated answer to a customer message. Empty means stay silent.
 */
public interface CustomerInquiryResponder {

    Optional<CustomerReply> respond(Conversation conversation, ClassificationResult classification, String text);
}
