package com.ainotes.client;

import reactor.core.publisher.Mono;

/**
 * Narrow boundary to the external AI service.
 *
 * Both operations either emit a complete result or fail with
 * {@link com.ainotes.exception.EnrichmentException}. No retries happen here.
 */
public interface EnrichmentClient {

    /**
     * Generate a comma-separated tag string for a note.
     */
    Mono<String> generateTags(String title, String content);

    /**
     * Generate a fixed-length embedding vector for a note.
     */
    Mono<float[]> generateEmbedding(String title, String content);
}
