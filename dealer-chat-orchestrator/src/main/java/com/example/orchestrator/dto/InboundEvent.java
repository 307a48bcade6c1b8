package com.example.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Message event posted by the WhatsApp gateway, enriched with the tenant owning the gateway client.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundEvent {

    private String accountId;

    @NotBlank
    private String clientId;

    @NotBlank
    private String tenantId;

    /** Sender as delivered by the gateway: a phone, a device JID or an {@code @lid} alias. */
    @NotBlank
    private String from;

    @JsonAlias("text")
    private String message;

    private String messageId;

    private boolean hasMedia;

    private String mediaUrl;
}
