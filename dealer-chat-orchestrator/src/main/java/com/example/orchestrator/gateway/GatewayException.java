package com.example.orchestrator.gateway;

/**
 * The gateway refused a send or could not be reached.
 */
public class GatewayException extends RuntimeException {

    /** Status used when no HTTP response was received. */
    public static final int NO_RESPONSE = 0;

    private final int status;
    private final String body;

    public GatewayException(int status, String body) {
        super("Gateway responded with status %d: %s".formatted(status, body));
        this.status = status;
        this.body = body;
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
        this.status = NO_RESPONSE;
        this.body = null;
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }
}
