package com.ainotes.controller;

import com.ainotes.config.SecurityConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.reactive.server.WebTestClient;

/**
 * Integration tests for HealthController.
 */
@WebFluxTest(controllers = HealthController.class)
@Import(SecurityConfig.class)
class HealthControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @Test
    void root_ReturnsServiceInfo() {
        webTestClient.get()
                .uri("/")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.service").isEqualTo("AINotes")
                .jsonPath("$.version").isEqualTo("1.0.0");
    }

    @Test
    void health_ReturnsHealthStatus() {
        webTestClient.get()
                .uri("/v1/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("healthy")
                .jsonPath("$.version").isEqualTo("1.0.0");
    }

    @Test
    void unlistedPath_WithoutSubject_Unauthorized() {
        webTestClient.get()
                .uri("/actuator/health")
                .exchange()
                .expectStatus().isUnauthorized();
    }
}
