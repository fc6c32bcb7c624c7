package com.ainotes.store;

import com.ainotes.exception.PersistenceException;
import com.ainotes.model.entity.Note;
import com.ainotes.repository.NoteRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for R2dbcNoteStore.
 */
@ExtendWith(MockitoExtension.class)
class R2dbcNoteStoreTest {

    private static final LocalDateTime CREATED = LocalDateTime.of(2025, 3, 1, 8, 30);

    @Mock
    private NoteRepository noteRepository;

    @Mock
    private TransactionalOperator transactionalOperator;

    private R2dbcNoteStore store;
    private Note first;
    private Note second;

    @BeforeEach
    void setUp() {
        store = new R2dbcNoteStore(noteRepository, transactionalOperator);
        first = note("First");
        second = note("Second");
    }

    @Test
    void query_OnlyMissingTags_UsesUntaggedQuery() {
        when(noteRepository.findUntaggedByOwnerSubject("u1")).thenReturn(Flux.just(first, second));

        StepVerifier.create(store.query("u1", true))
                .expectNext(first, second)
                .verifyComplete();

        verify(noteRepository, never()).findByOwnerSubject(any());
    }

    @Test
    void query_AllNotes_UsesOwnerQuery() {
        when(noteRepository.findByOwnerSubject("u1")).thenReturn(Flux.just(first));

        StepVerifier.create(store.query("u1", false))
                .expectNext(first)
                .verifyComplete();
    }

    @Test
    void query_SameNoteTwice_ReturnsTrackedInstance() {
        Note reloaded = Note.builder().id(first.getId()).title("First").ownerSubject("u1").build();
        when(noteRepository.findByOwnerSubject("u1")).thenReturn(Flux.just(first), Flux.just(reloaded));

        store.query("u1", false).blockLast();
        Note again = store.query("u1", false).blockLast();

        assertSame(first, again);
    }

    @Test
    void commit_NothingChanged_DoesNotWrite() {
        when(noteRepository.findByOwnerSubject("u1")).thenReturn(Flux.just(first, second));
        store.query("u1", false).collectList().block();

        StepVerifier.create(store.commit()).verifyComplete();

        verify(noteRepository, never()).updateTags(any(), any(), any());
        verify(noteRepository, never()).updateEmbedding(any(), any(), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void commit_WritesOnlyChangedNotesOnce() {
        when(noteRepository.findByOwnerSubject("u1")).thenReturn(Flux.just(first, second));
        when(noteRepository.updateTags(any(), any(), any())).thenReturn(Mono.just(1));
        when(transactionalOperator.transactional(any(Flux.class))).thenAnswer(invocation -> invocation.getArgument(0));

        store.query("u1", false).collectList().block();
        second.setTags("spring, r2dbc");
        second.setUpdatedAt(CREATED.plusDays(1));

        StepVerifier.create(store.commit()).verifyComplete();
        StepVerifier.create(store.commit()).verifyComplete();

        verify(noteRepository, times(1)).updateTags(second.getId(), "spring, r2dbc", CREATED.plusDays(1));
        verify(noteRepository, never()).updateTags(eq(first.getId()), any(), any());
        verify(noteRepository, never()).updateEmbedding(any(), any(), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void commit_WritesEnrichmentColumnsOnly_LeavesTitleAndContentAlone() {
        when(noteRepository.findByOwnerSubject("u1")).thenReturn(Flux.just(first));
        when(noteRepository.updateTags(any(), any(), any())).thenReturn(Mono.just(1));
        when(transactionalOperator.transactional(any(Flux.class))).thenAnswer(invocation -> invocation.getArgument(0));

        store.query("u1", false).blockLast();
        first.setTags("notes");
        first.setUpdatedAt(CREATED.plusHours(2));

        StepVerifier.create(store.commit()).verifyComplete();

        verify(noteRepository).updateTags(first.getId(), "notes", CREATED.plusHours(2));
        verify(noteRepository, never()).save(any());
        verify(noteRepository, never()).saveAll(anyIterable());
    }

    @Test
    @SuppressWarnings("unchecked")
    void commit_EmbeddingChangedInPlace_IsDetected() {
        first.setEmbedding(new float[]{0.1f, 0.2f});
        when(noteRepository.findByOwnerSubject("u1")).thenReturn(Flux.just(first));
        when(noteRepository.updateEmbedding(any(), any(), any())).thenReturn(Mono.just(1));
        when(transactionalOperator.transactional(any(Flux.class))).thenAnswer(invocation -> invocation.getArgument(0));

        store.query("u1", false).blockLast();
        first.getEmbedding()[1] = 0.9f;

        StepVerifier.create(store.commit()).verifyComplete();

        ArgumentCaptor<float[]> captor = ArgumentCaptor.forClass(float[].class);
        verify(noteRepository).updateEmbedding(eq(first.getId()), captor.capture(), eq(CREATED));
        assertArrayEquals(new float[]{0.1f, 0.9f}, captor.getValue());
        verify(noteRepository, never()).updateTags(any(), any(), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void commit_NoteDeletedDuringRun_CompletesAndRebases() {
        when(noteRepository.findByOwnerSubject("u1")).thenReturn(Flux.just(first));
        when(noteRepository.updateTags(any(), any(), any())).thenReturn(Mono.just(0));
        when(transactionalOperator.transactional(any(Flux.class))).thenAnswer(invocation -> invocation.getArgument(0));

        store.query("u1", false).blockLast();
        first.setTags("gone");

        StepVerifier.create(store.commit()).verifyComplete();
        StepVerifier.create(store.commit()).verifyComplete();

        verify(noteRepository, times(1)).updateTags(any(), any(), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void commit_StorageFailure_SignalsPersistenceExceptionAndKeepsChangesPending() {
        when(noteRepository.findByOwnerSubject("u1")).thenReturn(Flux.just(first));
        when(noteRepository.updateTags(any(), any(), any()))
                .thenReturn(Mono.error(new IllegalStateException("constraint violated")), Mono.just(1));
        when(transactionalOperator.transactional(any(Flux.class))).thenAnswer(invocation -> invocation.getArgument(0));

        store.query("u1", false).blockLast();
        first.setTags("x");

        StepVerifier.create(store.commit())
                .expectErrorMatches(error -> error instanceof PersistenceException &&
                        error.getMessage().contains("constraint violated"))
                .verify();

        // still pending, so the next commit writes it again
        StepVerifier.create(store.commit()).verifyComplete();
        verify(noteRepository, times(2)).updateTags(first.getId(), "x", CREATED);
    }

    private Note note(String title) {
        return Note.builder()
                .id(UUID.randomUUID())
                .title(title)
                .content("Body of " + title)
                .createdAt(CREATED)
                .updatedAt(CREATED)
                .ownerSubject("u1")
                .build();
    }
}
