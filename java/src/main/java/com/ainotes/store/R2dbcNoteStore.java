package com.ainotes.store;

import com.ainotes.exception.PersistenceException;
import com.ainotes.model.entity.Note;
import com.ainotes.repository.NoteRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * {@link NoteStore} backed by {@link NoteRepository}.
 *
 * Every note handed out is tracked together with a snapshot of its mutable
 * fields. A commit writes the notes whose fields moved away from their
 * snapshot in a single transaction and then re-baselines them. Only the
 * enrichment columns are written; title and content edits made by the user
 * while a run is in progress survive the commit.
 */
@Slf4j
public class R2dbcNoteStore implements NoteStore {

    private final NoteRepository noteRepository;
    private final TransactionalOperator transactionalOperator;

    private final Map<UUID, Tracked> tracked = new LinkedHashMap<>();

    public R2dbcNoteStore(NoteRepository noteRepository, TransactionalOperator transactionalOperator) {
        this.noteRepository = noteRepository;
        this.transactionalOperator = transactionalOperator;
    }

    @Override
    public Flux<Note> query(String ownerSubject, boolean onlyMissingTags) {
        Flux<Note> notes = onlyMissingTags
                ? noteRepository.findUntaggedByOwnerSubject(ownerSubject)
                : noteRepository.findByOwnerSubject(ownerSubject);

        return notes.map(this::track);
    }

    @Override
    public Mono<Void> commit() {
        return Mono.defer(() -> {
            List<Tracked> dirty = new ArrayList<>();
            for (Tracked entry : tracked.values()) {
                if (entry.isDirty()) {
                    dirty.add(entry);
                }
            }

            if (dirty.isEmpty()) {
                return Mono.empty();
            }

            Flux<Integer> writes = Flux.fromIterable(dirty).concatMap(this::write);
            return transactionalOperator.transactional(writes)
                    .then()
                    .doOnSuccess(ignored -> {
                        dirty.forEach(Tracked::rebase);
                        log.debug("Committed {} note(s)", dirty.size());
                    })
                    .onErrorMap(error -> !(error instanceof PersistenceException),
                            error -> new PersistenceException(
                                    "Failed to commit " + dirty.size() + " note(s): " + error.getMessage(), error));
        });
    }

    private Flux<Integer> write(Tracked entry) {
        Note note = entry.note();
        List<Mono<Integer>> updates = new ArrayList<>();
        if (entry.tagsChanged() || !entry.embeddingChanged()) {
            updates.add(noteRepository.updateTags(note.getId(), note.getTags(), note.getUpdatedAt()));
        }
        if (entry.embeddingChanged()) {
            updates.add(noteRepository.updateEmbedding(note.getId(), note.getEmbedding(), note.getUpdatedAt()));
        }
        return Flux.concat(updates)
                .doOnNext(rows -> {
                    if (rows == 0) {
                        log.warn("Note {} was deleted during the run, its changes were dropped", note.getId());
                    }
                });
    }

    private Note track(Note note) {
        Tracked existing = tracked.get(note.getId());
        if (existing != null) {
            return existing.note();
        }
        tracked.put(note.getId(), new Tracked(note));
        return note;
    }

    private static final class Tracked {

        private final Note note;
        private String tags;
        private float[] embedding;
        private LocalDateTime updatedAt;

        private Tracked(Note note) {
            this.note = note;
            rebase();
        }

        Note note() {
            return note;
        }

        boolean isDirty() {
            return tagsChanged() || embeddingChanged() || !Objects.equals(updatedAt, note.getUpdatedAt());
        }

        boolean tagsChanged() {
            return !Objects.equals(tags, note.getTags());
        }

        boolean embeddingChanged() {
            return !Arrays.equals(embedding, note.getEmbedding());
        }

        void rebase() {
            tags = note.getTags();
            embedding = note.getEmbedding() == null ? null : note.getEmbedding().clone();
            updatedAt = note.getUpdatedAt();
        }
    }
}
