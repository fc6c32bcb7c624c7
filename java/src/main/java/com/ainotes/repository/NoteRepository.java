package com.ainotes.repository;

import com.ainotes.model.entity.Note;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Repository for Note entities.
 *
 * Ordering is fixed on (created_at, id) so that repeated reads of the same
 * snapshot produce the same sequence.
 */
@Repository
public interface NoteRepository extends ReactiveCrudRepository<Note, UUID> {

    /**
     * All notes of one owner.
     */
    @Query("SELECT * FROM notes WHERE owner_subject = :ownerSubject ORDER BY created_at ASC, id ASC")
    Flux<Note> findByOwnerSubject(String ownerSubject);

    /**
     * Notes of one owner whose tags are null or empty.
     */
    @Query("SELECT * FROM notes WHERE owner_subject = :ownerSubject AND (tags IS NULL OR tags = '') " +
            "ORDER BY created_at ASC, id ASC")
    Flux<Note> findUntaggedByOwnerSubject(String ownerSubject);

    Mono<Note> findByIdAndOwnerSubject(UUID id, String ownerSubject);

    /**
     * Write tags and the modification timestamp only, leaving title and
     * content as the user last saved them.
     *
     * @return number of rows updated, 0 if the note no longer exists
     */
    @Modifying
    @Query("UPDATE notes SET tags = :tags, updated_at = :updatedAt WHERE id = :id")
    Mono<Integer> updateTags(UUID id, String tags, LocalDateTime updatedAt);

    /**
     * Write the embedding and the modification timestamp only.
     *
     * @return number of rows updated, 0 if the note no longer exists
     */
    @Modifying
    @Query("UPDATE notes SET embedding = :embedding, updated_at = :updatedAt WHERE id = :id")
    Mono<Integer> updateEmbedding(UUID id, float[] embedding, LocalDateTime updatedAt);
}
