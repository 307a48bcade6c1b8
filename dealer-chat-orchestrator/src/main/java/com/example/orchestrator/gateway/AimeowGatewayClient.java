package com.example.orchestrator.gateway;

import com.example.orchestrator.config.OrchestratorProperties;
import com.example.orchestrator.identity.PhoneNormalizer;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.util.retry.Retry;

/**
 * {@link GatewayAdapter} for the Aimeow multi-device WhatsApp gateway.
 *
 * <p>Failures without a response, 429 and 5xx are retried with exponential backoff up to
 * {@code orchestrator.delivery.retry.max-attempts}; any other 4xx is final.
 */
@Slf4j
@Component
public class AimeowGatewayClient implements GatewayAdapter {

    private static final String SEND_MESSAGE = "/api/v1/clients/{clientId}/send-message";
    private static final String SEND_DOCUMENT = "/api/v1/clients/{clientId}/send-document";
    private static final String SEND_IMAGES = "/api/v1/clients/{clientId}/send-images";

    private final WebClient gatewayWebClient;
    private final PhoneNormalizer phoneNormalizer;
    private final Duration timeout;
    private final Retry retrySpec;

    public AimeowGatewayClient(
            @Qualifier("gatewayWebClient") WebClient gatewayWebClient,
            PhoneNormalizer phoneNormalizer,
            OrchestratorProperties properties) {
        this.gatewayWebClient = gatewayWebClient;
        this.phoneNormalizer = phoneNormalizer;
        this.timeout = properties.getGateway().getTimeout();
        this.retrySpec = buildRetrySpec(properties.getDelivery().getRetry());
    }

    private static Retry buildRetrySpec(OrchestratorProperties.Delivery.Retry retry) {
        return Retry.backoff(Math.max(retry.getMaxAttempts() - 1, 0), retry.getInitialBackoff())
                .maxBackoff(retry.getMaxBackoff())
                .filter(AimeowGatewayClient::isTransient)
                .doBeforeRetry(signal -> log.info("Gateway call failed (retry {}/{}): {}",
                        signal.totalRetries() + 1, retry.getMaxAttempts() - 1, signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    static boolean isTransient(Throwable failure) {
        if (!(failure instanceof GatewayException)) {
            return false;
        }
        int status = ((GatewayException) failure).getStatus();
        return status == GatewayException.NO_RESPONSE || status == 429 || status >= 500;
    }

    @Override
    public GatewaySendResult sendText(String clientId, String to, String text) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("to", recipient(to));
        body.put("text", text);
        return post(SEND_MESSAGE, clientId, body);
    }

    @Override
    public GatewaySendResult sendDocument(String clientId, String to, String base64, String filename, String caption) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("to", recipient(to));
        body.put("document", base64);
        body.put("filename", filename);
        if (StringUtils.hasText(caption)) {
            body.put("caption", caption);
        }
        return post(SEND_DOCUMENT, clientId, body);
    }

    @Override
    public GatewaySendResult sendImage(String clientId, String to, String imageData, String caption) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("to", recipient(to));
        body.put("images", List.of(imageData));
        if (StringUtils.hasText(caption)) {
            body.put("caption", caption);
        }
        return post(SEND_IMAGES, clientId, body);
    }

    private GatewaySendResult post(String path, String clientId, Map<String, Object> body) {
        if (!StringUtils.hasText(clientId)) {
            throw new IllegalArgumentException("Gateway clientId is required");
        }
        JsonNode response;
        try {
            response = gatewayWebClient.post()
                    .uri(path, clientId)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, clientResponse -> clientResponse
                            .bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(errorBody -> new GatewayException(clientResponse.statusCode().value(), errorBody)))
                    .bodyToMono(JsonNode.class)
                    .onErrorMap(ex -> !(ex instanceof GatewayException),
                            ex -> new GatewayException("Gateway call to " + path + " failed: " + ex.getMessage(), ex))
                    .retryWhen(retrySpec)
                    .block(timeout);
        } catch (GatewayException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new GatewayException("Gateway call to " + path + " failed: " + ex.getMessage(), ex);
        }

        String messageId = extractMessageId(response);
        log.debug("Gateway accepted {} for client {} as {}", path, clientId, messageId);
        return new GatewaySendResult(messageId);
    }

    private String recipient(String to) {
        if (to != null && to.contains("@")) {
            return to;
        }
        return phoneNormalizer.variants(phoneNormalizer.normalize(to)).countryCodePrefixed();
    }

    private String extractMessageId(JsonNode response) {
        if (response != null) {
            if (response.hasNonNull("messageId")) {
                return response.get("messageId").asText();
            }
            if (response.hasNonNull("id")) {
                return response.get("id").asText();
            }
        }
        return "msg_" + System.currentTimeMillis();
    }
}
