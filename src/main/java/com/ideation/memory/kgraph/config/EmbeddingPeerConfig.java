package com.ideation.memory.kgraph.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client for the embedding/clustering peer.
 * Every call shares the same bounded timeout so an unreachable peer cannot stall a mutation.
 */
@Configuration
@Slf4j
public class EmbeddingPeerConfig {

    @Value("${kgraph.embedding.base-url:http://localhost:8000}")
    private String baseUrl;

    @Value("${kgraph.embedding.timeout-seconds:15}")
    private int timeoutSeconds;

    @Bean
    public RestTemplate embeddingRestTemplate(RestTemplateBuilder builder) {
        log.info("[Embedding Peer] Using {} with {}s timeout", baseUrl, timeoutSeconds);

        return builder
                .rootUri(baseUrl)
                .setConnectTimeout(Duration.ofSeconds(timeoutSeconds))
                .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }
}
