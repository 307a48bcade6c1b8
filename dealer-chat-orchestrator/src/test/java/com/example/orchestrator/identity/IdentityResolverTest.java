package com.example.orchestrator.identity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.orchestrator.config.OrchestratorProperties;
import com.example.orchestrator.domain.Conversation;
import com.example.orchestrator.domain.ConversationContext;
import com.example.orchestrator.domain.StaffIdentity;
import com.example.orchestrator.domain.StaffRole;
import com.example.orchestrator.service.ConversationRepository;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IdentityResolverTest {

    private static final String TENANT = "tenant-1";

    @Mock
    private StaffDirectory staffDirectory;

    @Mock
    private ConversationRepository conversationRepository;

    private IdentityResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new IdentityResolver(new PhoneNormalizer(new OrchestratorProperties()), staffDirectory,
                conversationRepository);
    }

    @Test
    @DisplayName("Stored local format matches an international sender")
    void matchesAcrossFormats() {
        when(staffDirectory.findCandidates(TENANT)).thenReturn(List.of(
                staff("s1", "0812-3456-7890", StaffRole.ADMIN),
                staff("s2", "081299998888", StaffRole.SALES)));

        IdentityResolution resolution = resolver.resolve(TENANT, "6281234567890@s.whatsapp.net");

        assertThat(resolution.isStaff()).isTrue();
        assertThat(resolution.ambiguous()).isFalse();
        assertThat(resolution.staff()).map(StaffIdentity::getId).contains("s1");
        assertThat(resolution.roleLevel()).isEqualTo(90);
        assertThat(resolution.viaAlias()).isFalse();
    }

    @Test
    void unknownNumberIsCustomer() {
        when(staffDirectory.findCandidates(TENANT)).thenReturn(List.of(staff("s1", "081299998888", StaffRole.SALES)));
        when(conversationRepository.findByLinkedLid(TENANT, "6281234567890")).thenReturn(Optional.empty());

        IdentityResolution resolution = resolver.resolve(TENANT, "6281234567890");

        assertThat(resolution.isStaff()).isFalse();
        assertThat(resolution.hasMatches()).isFalse();
        assertThat(resolution.roleLevel()).isZero();
    }

    @Test
    @DisplayName("Two records sharing a number are ambiguous and not staff")
    void ambiguousIdentity() {
        when(staffDirectory.findCandidates(TENANT)).thenReturn(List.of(
                staff("s1", "081234567890", StaffRole.OWNER),
                staff("s2", "+6281234567890", StaffRole.SALES)));

        IdentityResolution resolution = resolver.resolve(TENANT, "081234567890");

        assertThat(resolution.ambiguous()).isTrue();
        assertThat(resolution.isStaff()).isFalse();
        assertThat(resolution.staff()).isEmpty();
        assertThat(resolution.identities()).hasSize(2);
        assertThat(resolution.roleLevel()).isZero();
    }

    @Test
    void roleLevelOverrideWins() {
        StaffIdentity custom = staff("s1", "081234567890", StaffRole.SALES);
        custom.setRoleLevel(95);
        when(staffDirectory.findCandidates(TENANT)).thenReturn(List.of(custom));

        assertThat(resolver.resolve(TENANT, "081234567890").roleLevel()).isEqualTo(95);
    }

    @Test
    @DisplayName("Alias identifiers follow a verified conversation link")
    void resolvesAliasThroughLinkedConversation() {
        when(conversationRepository.findByLinkedLid(TENANT, "10987654321"))
                .thenReturn(Optional.of(linkedConversation("10987654321", "6281234567890")));
        when(staffDirectory.findCandidates(TENANT)).thenReturn(List.of(staff("s1", "081234567890", StaffRole.ADMIN)));

        IdentityResolution resolution = resolver.resolve(TENANT, "10987654321@lid");

        assertThat(resolution.isStaff()).isTrue();
        assertThat(resolution.viaAlias()).isTrue();
        assertThat(resolution.aliasId()).isEqualTo("10987654321");
        assertThat(resolution.phone()).isEqualTo("6281234567890");
    }

    @Test
    void unlinkedAliasIsCustomerWithoutDirectoryLookup() {
        when(conversationRepository.findByLinkedLid(TENANT, "10987654321")).thenReturn(Optional.empty());

        IdentityResolution resolution = resolver.resolve(TENANT, "10987654321@lid");

        assertThat(resolution.isStaff()).isFalse();
        verify(staffDirectory, never()).findCandidates(anyString());
    }

    @Test
    void aliasDigitsWithoutSuffixFallBackToLinks() {
        when(staffDirectory.findCandidates(TENANT)).thenReturn(List.of(staff("s1", "081234567890", StaffRole.SALES)));
        when(conversationRepository.findByLinkedLid(TENANT, "10987654321"))
                .thenReturn(Optional.of(linkedConversation("10987654321", "081234567890")));

        IdentityResolution resolution = resolver.resolve(TENANT, "10987654321");

        assertThat(resolution.isStaff()).isTrue();
        assertThat(resolution.viaAlias()).isTrue();
    }

    @Test
    void blankIdentifierResolvesToNobody() {
        IdentityResolution resolution = resolver.resolve(TENANT, "  ");

        assertThat(resolution.isStaff()).isFalse();
        assertThat(resolution.phone()).isEmpty();
    }

    private static StaffIdentity staff(String id, String phone, StaffRole role) {
        return StaffIdentity.builder()
                .id(id)
                .tenantId(TENANT)
                .firstName("Staff")
                .lastName(id)
                .phone(phone)
                .role(role)
                .build();
    }

    private static Conversation linkedConversation(String lid, String staffPhone) {
        return Conversation.builder()
                .id("conv-alias")
                .tenantId(TENANT)
                .customerPhone(lid)
                .context(ConversationContext.builder()
                        .verifiedStaffPhone(staffPhone)
                        .linkedLids(new LinkedHashSet<>(Set.of(lid)))
                        .build())
                .build();
    }
}
