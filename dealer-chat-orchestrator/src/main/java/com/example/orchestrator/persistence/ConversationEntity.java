package com.example.orchestrator.persistence;

import com.example.orchestrator.domain.ConversationStatus;
import com.example.orchestrator.domain.ConversationType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "whatsapp_conversations",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_whatsapp_conversations_tenant_phone",
                columnNames = {"tenant_id", "customer_phone"}),
        indexes = @Index(name = "idx_whatsapp_conversations_tenant_status", columnList = "tenant_id,status"))
public class ConversationEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "tenant_id", nullable = false, updatable = false, length = 64)
    private String tenantId;

    @Column(name = "customer_phone", nullable = false, updatable = false, length = 32)
    private String customerPhone;

    @Column(name = "is_staff", nullable = false)
    private boolean staff;

    @Enumerated(EnumType.STRING)
    @Column(name = "conversation_type", nullable = false, length = 16)
    private ConversationType conversationType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ConversationStatus status;

    @Column(name = "escalated_at")
    private Instant escalatedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_message_at")
    private Instant lastMessageAt;

    @Column(name = "context_data", columnDefinition = "text")
    private String contextData;

    @Version
    @Column(name = "version")
    private Long version;
}
