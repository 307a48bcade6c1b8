package com.example.orchestrator.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "orchestrator.security")
public class OrchestratorSecurityProperties {

    /**
     * Toggle to enable or disable the inbound HTTP rate limiter.
     */
    private boolean rateLimitingEnabled = true;

    /**
     * Origins allowed to call the admin API from a browser.
     */
    private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));

    /**
     * Gateway client ids trusted in the {@code X-Client-Id} header. Webhook calls naming one of them share
     * that client's bucket; every other call is limited by its remote address.
     */
    private List<String> gatewayClients = new ArrayList<>();

    private final RateLimit rateLimit = new RateLimit();

    public boolean isRateLimitingEnabled() {
        return rateLimitingEnabled;
    }

    public void setRateLimitingEnabled(boolean rateLimitingEnabled) {
        this.rateLimitingEnabled = rateLimitingEnabled;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    public List<String> getGatewayClients() {
        return gatewayClients;
    }

    public void setGatewayClients(List<String> gatewayClients) {
        this.gatewayClients = gatewayClients;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    @Validated
    public static class RateLimit {

        /**
         * Maximum number of webhook calls accepted per key and refill period.
         */
        private long capacity = 600;

        /**
         * Number of tokens replenished every {@link #refillPeriod}.
         */
        private long refillTokens = 600;

        /**
         * Interval at which tokens are replenished.
         */
        private Duration refillPeriod = Duration.ofSeconds(60);

        /**
         * Upper bound on buckets kept in memory; the least recently used are dropped first.
         */
        private long maxTrackedKeys = 10_000;

        public long getCapacity() {
            return capacity;
        }

        public void setCapacity(long capacity) {
            this.capacity = capacity;
        }

        public long getRefillTokens() {
            return refillTokens;
        }

        public void setRefillTokens(long refillTokens) {
            this.refillTokens = refillTokens;
        }

        public Duration getRefillPeriod() {
            return refillPeriod;
        }

        public void setRefillPeriod(Duration refillPeriod) {
            this.refillPeriod = refillPeriod;
        }

        public long getMaxTrackedKeys() {
            return maxTrackedKeys;
        }

        public void setMaxTrackedKeys(long maxTrackedKeys) {
            this.maxTrackedKeys = maxTrackedKeys;
        }
    }
}
