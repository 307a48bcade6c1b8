package com.example.orchestrator.gateway;

/**
 * Outbound WhatsApp delivery. Implementations block until the gateway accepted or rejected the
 * message and signal rejection with {@link GatewayException}.
 *
 * <p>{@code to} is either a phone number in any format or a full gateway identifier such as
 * {@code 1234@lid}.
 */
public interface GatewayAdapter {

    GatewaySendResult sendText(String clientId, String to, String text);

    GatewaySendResult sendDocument(String clientId, String to, String base64, String filename, String caption);

    GatewaySendResult sendImage(String clientId, String to, String imageData, String caption);
}
