package com.example.orchestrator.broadcast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.orchestrator.config.OrchestratorProperties;
import com.example.orchestrator.domain.StaffIdentity;
import com.example.orchestrator.domain.StaffRole;
import com.example.orchestrator.gateway.GatewayAdapter;
import com.example.orchestrator.gateway.GatewayException;
import com.example.orchestrator.gateway.GatewaySendResult;
import com.example.orchestrator.identity.PhoneNormalizer;
import com.example.orchestrator.identity.StaffDirectory;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BroadcastDispatcherTest {

    private static final String TENANT = "tenant-1";
    private static final String CLIENT = "client-1";
    private static final byte[] PDF = "%PDF-1.4".getBytes(StandardCharsets.US_ASCII);
    private static final Set<StaffRole> MANAGEMENT = Set.of(StaffRole.OWNER, StaffRole.ADMIN, StaffRole.SUPER_ADMIN);

    @Mock
    private StaffDirectory staffDirectory;

    @Mock
    private GatewayAdapter gatewayAdapter;

    private BroadcastDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new BroadcastDispatcher(staffDirectory, new PhoneNormalizer(new OrchestratorProperties()),
                gatewayAdapter);
    }

    @Test
    @DisplayName("Requester is excluded even when stored in local format")
    void excludesRequesterAcrossFormats() {
        when(staffDirectory.findByRoles(TENANT, MANAGEMENT)).thenReturn(List.of(
                staff("owner", "0812-3456-7890", StaffRole.OWNER),
                staff("admin", "+62 811 1111 1111", StaffRole.ADMIN)));
        when(gatewayAdapter.sendDocument(anyString(), anyString(), anyString(), anyString(), any()))
                .thenReturn(new GatewaySendResult("m1"));

        BroadcastResult result = dispatcher.broadcast(job("6281234567890"));

        assertThat(result.delivered()).isEqualTo(1);
        assertThat(result.failed()).isZero();
        assertThat(result.deliveredTo()).containsExactly("6281111111111");
        verify(gatewayAdapter).sendDocument(eq(CLIENT), eq("6281111111111"),
                eq(Base64.getEncoder().encodeToString(PDF)), eq("sales-summary.pdf"), eq("Sales Summary"));
    }

    @ParameterizedTest(name = "requester {0} vs stored {1}")
    @CsvSource({
            "081234567890, 6281234567890",
            "081234567890, +62 812-3456-7890",
            "6281234567890, 081234567890",
            "6281234567890, 0812-3456-7890",
            "6281234567890@s.whatsapp.net, 081234567890",
            "6281234567890@s.whatsapp.net, +62 812 3456 7890",
            "6281234567890:7@s.whatsapp.net, 6281234567890"
    })
    void requesterNeverReceivesOwnBroadcast(String requester, String storedPhone) {
        when(staffDirectory.findByRoles(TENANT, MANAGEMENT)).thenReturn(List.of(
                staff("owner", storedPhone, StaffRole.OWNER),
                staff("admin", "081111111111", StaffRole.ADMIN)));
        when(gatewayAdapter.sendDocument(anyString(), anyString(), anyString(), anyString(), any()))
                .thenReturn(new GatewaySendResult("m1"));

        BroadcastResult result = dispatcher.broadcast(job(requester));

        assertThat(result.deliveredTo()).containsExactly("6281111111111");
        verify(gatewayAdapter, never()).sendDocument(anyString(), eq("6281234567890"), anyString(), anyString(), any());
        verify(gatewayAdapter, never()).sendDocument(anyString(), eq("081234567890"), anyString(), anyString(), any());
    }

    @Test
    void sameNumberInTwoFormatsGetsOneCopy() {
        when(staffDirectory.findByRoles(TENANT, MANAGEMENT)).thenReturn(List.of(
                staff("a", "081111111111", StaffRole.ADMIN),
                staff("b", "6281111111111", StaffRole.OWNER)));
        when(gatewayAdapter.sendDocument(anyString(), anyString(), anyString(), anyString(), any()))
                .thenReturn(new GatewaySendResult("m1"));

        BroadcastResult result = dispatcher.broadcast(job("6289999999999"));

        assertThat(result.delivered()).isEqualTo(1);
        verify(gatewayAdapter, times(1)).sendDocument(anyString(), anyString(), anyString(), anyString(), any());
    }

    @Test
    @DisplayName("One failed recipient does not stop the others")
    void partialFailure() {
        when(staffDirectory.findByRoles(TENANT, MANAGEMENT)).thenReturn(List.of(
                staff("a", "6281111111111", StaffRole.ADMIN),
                staff("b", "6282222222222", StaffRole.OWNER),
                staff("c", "6283333333333", StaffRole.SUPER_ADMIN)));
        when(gatewayAdapter.sendDocument(anyString(), anyString(), anyString(), anyString(), any()))
                .thenReturn(new GatewaySendResult("m1"));
        when(gatewayAdapter.sendDocument(anyString(), eq("6282222222222"), anyString(), anyString(), any()))
                .thenThrow(new GatewayException(500, "device offline"));

        BroadcastResult result = dispatcher.broadcast(job("6289999999999"));

        assertThat(result.delivered()).isEqualTo(2);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.deliveredTo()).containsExactly("6281111111111", "6283333333333");
        assertThat(result.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.recipient()).isEqualTo("6282222222222");
            assertThat(failure.reason()).contains("500");
        });
    }

    @Test
    void recipientsWithoutPhoneAreSkipped() {
        when(staffDirectory.findByRoles(TENANT, MANAGEMENT)).thenReturn(List.of(staff("a", "  ", StaffRole.ADMIN)));

        BroadcastResult result = dispatcher.broadcast(job("6289999999999"));

        assertThat(result).isEqualTo(BroadcastResult.empty());
        verify(gatewayAdapter, never()).sendDocument(anyString(), anyString(), anyString(), anyString(), any());
    }

    @Test
    void nothingToDoWithoutRoles() {
        BroadcastJob job = new BroadcastJob(PDF, "sales-summary.pdf", "Sales Summary", Set.of(), TENANT, CLIENT,
                "6289999999999");

        assertThat(dispatcher.broadcast(job).attempted()).isZero();
        verifyNoInteractions(staffDirectory, gatewayAdapter);
    }

    private static BroadcastJob job(String requester) {
        return new BroadcastJob(PDF, "sales-summary.pdf", "Sales Summary", MANAGEMENT, TENANT, CLIENT, requester);
    }

    private static StaffIdentity staff(String id, String phone, StaffRole role) {
        return StaffIdentity.builder().id(id).tenantId(TENANT).firstName(id).phone(phone).role(role).build();
    }
}
