package com.example.orchestrator.controller;

import com.example.orchestrator.dto.InboundEvent;
import com.example.orchestrator.dto.InboundResult;
import com.example.orchestrator.service.InboundMessageService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/webhooks")
public class WebhookController {

    private final InboundMessageService inboundMessageService;

    public WebhookController(InboundMessageService inboundMessageService) {
        this.inboundMessageService = inboundMessageService;
    }

    @PostMapping("/aimeow")
    public ResponseEntity<InboundResult> receive(@Valid @RequestBody InboundEvent event) {
        return ResponseEntity.ok(inboundMessageService.handle(event));
    }
}
