package com.example.orchestrator.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Outbound HTTP clients for the WhatsApp gateway and the dealership platform.
 */
@Configuration
public class WebClientConfig {

    private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;

    @Bean
    public WebClient gatewayWebClient(WebClient.Builder builder, OrchestratorProperties properties) {
        OrchestratorProperties.Gateway gateway = properties.getGateway();
        return builder.clone()
                .baseUrl(gateway.getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .clientConnector(new ReactorClientHttpConnector(httpClient(gateway.getTimeout())))
                .exchangeStrategies(largePayloads())
                .build();
    }

    @Bean
    public WebClient platformWebClient(WebClient.Builder builder, OrchestratorProperties properties) {
        OrchestratorProperties.Platform platform = properties.getPlatform();
        WebClient.Builder clientBuilder = builder.clone()
                .baseUrl(platform.getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .clientConnector(new ReactorClientHttpConnector(httpClient(platform.getTimeout())))
                .exchangeStrategies(largePayloads());
        if (StringUtils.hasText(platform.getInternalToken())) {
            clientBuilder.defaultHeader("X-Internal-Token", platform.getInternalToken());
        }
        return clientBuilder.build();
    }

    private HttpClient httpClient(Duration timeout) {
        long seconds = Math.max(timeout.toSeconds(), 1);
        return HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
                .responseTimeout(timeout)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(seconds, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(seconds, TimeUnit.SECONDS)));
    }

    // base64 report documents exceed the 256 KB codec default
    private ExchangeStrategies largePayloads() {
        return ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .build();
    }
}
