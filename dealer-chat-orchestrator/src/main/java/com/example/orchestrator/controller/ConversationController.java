package com.example.orchestrator.controller;

import com.example.orchestrator.domain.Conversation;
import com.example.orchestrator.domain.ConversationMessage;
import com.example.orchestrator.domain.ConversationStatus;
import com.example.orchestrator.dto.EscalateRequest;
import com.example.orchestrator.service.ConversationAdminService;
import java.util.List;
import java.util.Locale;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/conversations")
public class ConversationController {

    private final ConversationAdminService conversationAdminService;

    public ConversationController(ConversationAdminService conversationAdminService) {
        this.conversationAdminService = conversationAdminService;
    }

    @GetMapping
    public ResponseEntity<List<Conversation>> listConversations(
            @RequestParam String tenantId,
            @RequestParam(required = false) String status) {
        return ResponseEntity.ok(conversationAdminService.listConversations(tenantId, parseStatus(status)));
    }

    @GetMapping("/{conversationId}")
    public ResponseEntity<Conversation> getConversation(@PathVariable String conversationId) {
        return ResponseEntity.ok(conversationAdminService.getConversation(conversationId));
    }

    @GetMapping("/{conversationId}/messages")
    public ResponseEntity<List<ConversationMessage>> getMessages(
            @PathVariable String conversationId,
            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(conversationAdminService.getMessages(conversationId, limit));
    }

    @PostMapping("/{conversationId}/escalate")
    public ResponseEntity<Conversation> escalate(
            @PathVariable String conversationId,
            @RequestBody(required = false) EscalateRequest request) {
        String reason = request != null ? request.getReason() : "manual";
        return ResponseEntity.ok(conversationAdminService.escalate(conversationId, reason));
    }

    private ConversationStatus parseStatus(String status) {
        if (!StringUtils.hasText(status)) {
            return null;
        }
        try {
            return ConversationStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported conversation status: " + status);
        }
    }
}
