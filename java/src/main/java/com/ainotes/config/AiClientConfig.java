package com.ainotes.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * Wiring for the external AI service client.
 */
@Slf4j
@Configuration
public class AiClientConfig {

    @Bean
    public WebClient aiWebClient(
            WebClient.Builder webClientBuilder,
            @Value("${ainotes.ai.api-url:https://api.openai.com/v1}") String apiUrl,
            @Value("${ainotes.ai.api-key:}") String apiKey) {
        if (apiKey.isBlank()) {
            log.warn("ainotes.ai.api-key is not set; AI enrichment calls will be rejected upstream");
        }
        return webClientBuilder
                .baseUrl(apiUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
