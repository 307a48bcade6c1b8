package com.example.orchestrator.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.orchestrator.domain.Conversation;
import com.example.orchestrator.domain.ConversationContext;
import com.example.orchestrator.domain.ConversationStatus;
import com.example.orchestrator.domain.ConversationType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ConversationEntityMapperTest {

    private final ConversationEntityMapper mapper =
            new ConversationEntityMapper(new ObjectMapper().registerModule(new JavaTimeModule()));

    @Test
    void contextSurvivesStorage() {
        Instant verifiedAt = Instant.parse("2024-05-01T08:00:00Z");
        Conversation conversation = Conversation.builder()
                .id("c-1")
                .tenantId("tenant-1")
                .customerPhone("10987654321")
                .staff(true)
                .status(ConversationStatus.ESCALATED)
                .createdAt(verifiedAt)
                .context(ConversationContext.builder()
                        .verifiedStaffPhone("6281234567890")
                        .linkedLids(new LinkedHashSet<>(Set.of("10987654321")))
                        .originalLid("10987654321@lid")
                        .verifiedVia(ConversationContext.VERIFIED_VIA_VERIFY_COMMAND)
                        .verifiedAt(verifiedAt)
                        .build())
                .build();

        ConversationEntity entity = mapper.toEntity(conversation);
        Conversation restored = mapper.toDomain(entity);

        assertThat(entity.getConversationType()).isEqualTo(ConversationType.STAFF);
        assertThat(entity.getContextData()).contains("\"verifiedStaffPhone\":\"6281234567890\"");
        assertThat(restored.getContext()).isEqualTo(conversation.getContext());
        assertThat(restored.getStatus()).isEqualTo(ConversationStatus.ESCALATED);
    }

    @Test
    void unreadableContextFallsBackToEmpty() {
        ConversationEntity entity = new ConversationEntity();
        entity.setId("c-2");
        entity.setContextData("{not json");

        Conversation restored = mapper.toDomain(entity);

        assertThat(restored.getContext().getLinkedLids()).isEmpty();
        assertThat(restored.getStatus()).isEqualTo(ConversationStatus.ACTIVE);
    }
}
