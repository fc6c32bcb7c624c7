package com.ainotes.store;

import com.ainotes.model.entity.Note;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * A handle on persisted notes with unit-of-work semantics.
 *
 * <p>Changes made to notes obtained from {@link #query} are pending until
 * {@link #commit()} on the same handle completes. A handle belongs to one
 * backfill run and is not shared.
 */
public interface NoteStore {

    /**
     * Notes of the given owner, optionally restricted to notes without tags.
     * The sequence is stable for a given snapshot of the store.
     */
    Flux<Note> query(String ownerSubject, boolean onlyMissingTags);

    /**
     * Persists every pending change made since the last commit.
     * Signals {@link com.ainotes.exception.PersistenceException} on storage failure.
     */
    Mono<Void> commit();
}
