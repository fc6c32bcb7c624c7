package com.ainotes.service;

import com.ainotes.client.EnrichmentClient;
import com.ainotes.config.RelatedNotesProperties;
import com.ainotes.exception.InvalidRequestException;
import com.ainotes.exception.ResourceNotFoundException;
import com.ainotes.model.dto.RelatedNote;
import com.ainotes.model.dto.RelatedNotesResponse;
import com.ainotes.model.entity.Note;
import com.ainotes.repository.NoteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Service for related-note retrieval over stored embeddings.
 *
 * Ranking runs in PostgreSQL with the pgvector cosine distance operator.
 * Embeddings are stored as real[] and cast to vector per query, so notes
 * embedded by a model with another dimension are skipped rather than
 * compared.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RelatedNotesService {

    // $1 query vector, $2 its dimension, $3 owner, $4 query note id, $5 threshold, $6 limit
    static final String RELATED_NOTES_SQL =
            "SELECT id, title, tags, updated_at, score FROM (" +
            "SELECT id, title, tags, updated_at, " +
            "CASE WHEN cardinality(embedding) = $2 AND vector_norm(embedding::vector) > 0 " +
            "THEN 1 - (embedding::vector <=> $1::vector) END AS score " +
            "FROM notes " +
            "WHERE owner_subject = $3 AND id <> $4 AND embedding IS NOT NULL" +
            ") candidates " +
            "WHERE score >= $5 " +
            "ORDER BY score DESC, updated_at DESC NULLS LAST, id ASC " +
            "LIMIT $6";

    private final NoteRepository noteRepository;
    private final DatabaseClient databaseClient;
    private final EnrichmentClient enrichmentClient;
    private final RelatedNotesProperties properties;
    private final Clock clock;

    /**
     * Find the notes most similar to the given one.
     *
     * @param ownerSubject Owner of the note
     * @param noteId Note to find neighbours for
     * @param topN Maximum number of neighbours, or null for the configured default
     * @return Neighbours ordered by similarity, then most recent update, then id
     */
    public Mono<RelatedNotesResponse> findRelated(String ownerSubject, UUID noteId, Integer topN) {
        int limit = topN == null ? properties.getDefaultCount() : topN;
        if (limit < 1 || limit > properties.getMaxCount()) {
            return Mono.error(new InvalidRequestException(
                    "topN must be between 1 and " + properties.getMaxCount()));
        }

        return loadOwned(ownerSubject, noteId)
                .flatMap(note -> {
                    if (!note.hasEmbedding() || isZero(note.getEmbedding())) {
                        log.debug("Note {} has no usable embedding; no related notes", noteId);
                        return Mono.just(List.<RelatedNote>of());
                    }
                    return databaseClient.sql(RELATED_NOTES_SQL)
                            .bind("$1", formatVector(note.getEmbedding()))
                            .bind("$2", note.getEmbedding().length)
                            .bind("$3", ownerSubject)
                            .bind("$4", noteId)
                            .bind("$5", properties.getSimilarityThreshold())
                            .bind("$6", limit)
                            .fetch()
                            .all()
                            .map(this::toRelatedNote)
                            .collectList();
                })
                .map(related -> RelatedNotesResponse.builder()
                        .noteId(noteId.toString())
                        .relatedNotes(related)
                        .build());
    }

    /**
     * Generate and store a fresh embedding for one note.
     *
     * @param ownerSubject Owner of the note
     * @param noteId Note to embed
     * @return The updated note
     */
    public Mono<Note> refreshEmbedding(String ownerSubject, UUID noteId) {
        return loadOwned(ownerSubject, noteId)
                .flatMap(note -> enrichmentClient.generateEmbedding(note.getTitle(), note.getContent())
                        .flatMap(embedding -> {
                            note.setEmbedding(embedding);
                            note.setUpdatedAt(LocalDateTime.now(clock));
                            return noteRepository.updateEmbedding(note.getId(), embedding, note.getUpdatedAt())
                                    .flatMap(rows -> rows == 0
                                            ? Mono.<Note>error(new ResourceNotFoundException("Note", noteId.toString()))
                                            : Mono.just(note));
                        }))
                .doOnNext(saved -> log.info("Stored {}-dimensional embedding for note {}",
                        saved.getEmbedding().length, saved.getId()));
    }

    private Mono<Note> loadOwned(String ownerSubject, UUID noteId) {
        if (ownerSubject == null || ownerSubject.isBlank()) {
            return Mono.error(new InvalidRequestException("Owner subject is required"));
        }
        return noteRepository.findByIdAndOwnerSubject(noteId, ownerSubject)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Note", noteId.toString())));
    }

    private RelatedNote toRelatedNote(Map<String, Object> row) {
        return RelatedNote.builder()
                .id(row.get("id").toString())
                .title((String) row.get("title"))
                .tags((String) row.get("tags"))
                .updatedAt((LocalDateTime) row.get("updated_at"))
                .score(((Number) row.get("score")).doubleValue())
                .build();
    }

    // cosine distance against a zero vector is NaN, which PostgreSQL sorts above every number
    private static boolean isZero(float[] vector) {
        for (float component : vector) {
            if (component != 0f) {
                return false;
            }
        }
        return true;
    }

    /**
     * Format float array as pgvector string format.
     */
    private static String formatVector(float[] vector) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) sb.append(",");
            sb.append(vector[i]);
        }
        sb.append("]");
        return sb.toString();
    }
}
