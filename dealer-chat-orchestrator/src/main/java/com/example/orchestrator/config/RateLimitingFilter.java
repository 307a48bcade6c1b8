package com.example.orchestrator.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Token-bucket limit on gateway webhook deliveries.
 *
 * <p>Calls carrying a configured gateway client id in {@code X-Client-Id} share that client's bucket; all
 * other calls are keyed by the socket address. Forwarding headers are not consulted here, so put the
 * server behind {@code server.forward-headers-strategy} when a proxy sits in front of it.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RateLimitingFilter extends OncePerRequestFilter {

    static final String WEBHOOK_PATH_PREFIX = "/api/webhooks/";
    static final String CLIENT_HEADER = "X-Client-Id";

    private final OrchestratorSecurityProperties securityProperties;
    private final Set<String> gatewayClients;
    private final Cache<String, Bucket> buckets;

    public RateLimitingFilter(OrchestratorSecurityProperties securityProperties) {
        this.securityProperties = securityProperties;
        this.gatewayClients = securityProperties.getGatewayClients() == null ? Set.of()
                : securityProperties.getGatewayClients().stream()
                        .filter(StringUtils::hasText)
                        .map(String::trim)
                        .collect(Collectors.toUnmodifiableSet());
        OrchestratorSecurityProperties.RateLimit limitConfig = securityProperties.getRateLimit();
        // an untouched bucket is full again after this long, so forgetting it changes nothing
        this.buckets = Caffeine.newBuilder()
                .expireAfterAccess(refillDuration(limitConfig))
                .maximumSize(Math.max(limitConfig.getMaxTrackedKeys(), 1))
                .build();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(WEBHOOK_PATH_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        if (!securityProperties.isRateLimitingEnabled() || "OPTIONS".equalsIgnoreCase(request.getMethod())) {
            filterChain.doFilter(request, response);
            return;
        }

        String key = resolveKey(request);
        Bucket bucket = buckets.get(key, this::newBucket);
        if (bucket.tryConsume(1)) {
            filterChain.doFilter(request, response);
            return;
        }

        log.warn("Webhook rate limit exceeded for {}", key);
        writeRateLimitResponse(response);
    }

    private Bucket newBucket(String key) {
        OrchestratorSecurityProperties.RateLimit limitConfig = securityProperties.getRateLimit();
        return Bucket.builder()
                .addLimit(Bandwidth.classic(capacity(limitConfig),
                        Refill.greedy(refillTokens(limitConfig), refillPeriod(limitConfig))))
                .build();
    }

    private static long capacity(OrchestratorSecurityProperties.RateLimit limitConfig) {
        return Math.max(limitConfig.getCapacity(), 1);
    }

    private static long refillTokens(OrchestratorSecurityProperties.RateLimit limitConfig) {
        return Math.max(limitConfig.getRefillTokens(), 1);
    }

    private static Duration refillPeriod(OrchestratorSecurityProperties.RateLimit limitConfig) {
        Duration refillPeriod = limitConfig.getRefillPeriod();
        if (refillPeriod == null || refillPeriod.isZero() || refillPeriod.isNegative()) {
            return Duration.ofSeconds(60);
        }
        return refillPeriod;
    }

    /** Time for an empty bucket to refill completely. */
    private static Duration refillDuration(OrchestratorSecurityProperties.RateLimit limitConfig) {
        long tokens = refillTokens(limitConfig);
        long periods = (capacity(limitConfig) + tokens - 1) / tokens;
        return refillPeriod(limitConfig).multipliedBy(periods);
    }

    private void writeRateLimitResponse(HttpServletResponse response) throws IOException {
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        long retryAfterSeconds = Math.max(refillPeriod(securityProperties.getRateLimit()).toSeconds(), 1);
        response.setHeader("Retry-After", String.valueOf(retryAfterSeconds));
        response.getWriter()
                .write("{\"error\":\"too_many_requests\",\"message\":\"Webhook rate exceeded. Please retry later.\"}");
    }

    private String resolveKey(HttpServletRequest request) {
        String clientId = request.getHeader(CLIENT_HEADER);
        if (clientId != null && gatewayClients.contains(clientId.trim())) {
            return "client:" + clientId.trim();
        }
        return "ip:" + request.getRemoteAddr();
    }

    long trackedKeys() {
        buckets.cleanUp();
        return buckets.estimatedSize();
    }
}
