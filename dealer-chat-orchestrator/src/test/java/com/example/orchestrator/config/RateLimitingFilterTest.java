package com.example.orchestrator.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RateLimitingFilterTest {

    private OrchestratorSecurityProperties securityProperties;
    private RateLimitingFilter filter;

    @BeforeEach
    void setUp() {
        securityProperties = new OrchestratorSecurityProperties();
        securityProperties.setGatewayClients(List.of("client-1", "client-2"));
        securityProperties.getRateLimit().setCapacity(2);
        securityProperties.getRateLimit().setRefillTokens(2);
        securityProperties.getRateLimit().setRefillPeriod(Duration.ofMinutes(1));
        filter = new RateLimitingFilter(securityProperties);
    }

    @Test
    void limitsEachGatewayClientSeparately() throws Exception {
        assertThat(call("10.0.0.1", "client-1").getStatus()).isEqualTo(200);
        assertThat(call("10.0.0.1", "client-1").getStatus()).isEqualTo(200);

        MockHttpServletResponse limited = call("10.0.0.1", "client-1");
        assertThat(limited.getStatus()).isEqualTo(429);
        assertThat(limited.getHeader("Retry-After")).isEqualTo("60");
        assertThat(limited.getContentAsString()).contains("too_many_requests");

        assertThat(call("10.0.0.1", "client-2").getStatus()).isEqualTo(200);
    }

    @Test
    @DisplayName("Rotating an unknown client id does not buy a fresh bucket")
    void unknownClientIdsShareTheAddressBucket() throws Exception {
        int accepted = 0;
        for (int i = 0; i < 50; i++) {
            if (call("10.0.0.9", "spoof-" + i).getStatus() == 200) {
                accepted++;
            }
        }

        assertThat(accepted).isEqualTo(2);
        assertThat(call("10.0.0.10", "spoof-x").getStatus()).isEqualTo(200);
    }

    @Test
    void forwardedForHeaderDoesNotChangeTheKey() throws Exception {
        int accepted = 0;
        for (int i = 0; i < 10; i++) {
            MockHttpServletRequest request = webhook("10.0.0.9");
            request.addHeader("X-Forwarded-For", "192.168.1." + i);
            if (execute(request).getStatus() == 200) {
                accepted++;
            }
        }

        assertThat(accepted).isEqualTo(2);
    }

    @Test
    void trackedBucketsAreBounded() throws Exception {
        securityProperties.getRateLimit().setMaxTrackedKeys(3);
        filter = new RateLimitingFilter(securityProperties);

        for (int i = 0; i < 20; i++) {
            call("10.1.0." + i, null);
        }

        assertThat(filter.trackedKeys()).isLessThanOrEqualTo(3);
    }

    @Test
    void adminApiIsNotLimited() throws Exception {
        for (int i = 0; i < 5; i++) {
            MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/conversations");
            MockHttpServletResponse response = new MockHttpServletResponse();
            filter.doFilter(request, response, new MockFilterChain());
            assertThat(response.getStatus()).isEqualTo(200);
        }
    }

    @Test
    void disabledLimiterPassesEverything() throws Exception {
        securityProperties.setRateLimitingEnabled(false);

        for (int i = 0; i < 5; i++) {
            assertThat(call("10.0.0.1", "client-1").getStatus()).isEqualTo(200);
        }
    }

    private MockHttpServletResponse call(String remoteAddr, String clientId) throws Exception {
        MockHttpServletRequest request = webhook(remoteAddr);
        if (clientId != null) {
            request.addHeader(RateLimitingFilter.CLIENT_HEADER, clientId);
        }
        return execute(request);
    }

    private static MockHttpServletRequest webhook(String remoteAddr) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/webhooks/aimeow");
        request.setRemoteAddr(remoteAddr);
        return request;
    }

    private MockHttpServletResponse execute(MockHttpServletRequest request) throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, new MockFilterChain());
        return response;
    }
}
