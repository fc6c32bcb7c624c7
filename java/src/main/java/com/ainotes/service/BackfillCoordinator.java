package com.ainotes.service;

import com.ainotes.client.EnrichmentClient;
import com.ainotes.config.BackfillProperties;
import com.ainotes.exception.EnrichmentException;
import com.ainotes.exception.InvalidRequestException;
import com.ainotes.exception.PersistenceException;
import com.ainotes.model.dto.BackfillRequest;
import com.ainotes.model.dto.BackfillResult;
import com.ainotes.model.entity.Note;
import com.ainotes.store.NoteStore;
import com.ainotes.store.NoteStoreFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Drives tag backfill runs: scan an owner's notes, ask the AI service for
 * fresh tags note by note, and commit every few successes.
 *
 * <p>A failing note is recorded in the result and skipped; only a failed
 * commit aborts the run. Notes are handled strictly one after another so that
 * checkpoint counting follows the store's order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackfillCoordinator {

    private final NoteStoreFactory noteStoreFactory;
    private final EnrichmentClient enrichmentClient;
    private final BackfillProperties properties;
    private final Clock clock;

    /**
     * Run a backfill that cannot be cancelled.
     *
     * @param request Owner and candidate filter
     * @return Run summary, or a PersistenceException / InvalidRequestException
     */
    public Mono<BackfillResult> backfillTags(BackfillRequest request) {
        return backfillTags(request, BackfillCancellation.none());
    }

    /**
     * Run a backfill observing the given cancellation signal between notes.
     *
     * @param request Owner and candidate filter
     * @param cancellation Run-scoped cancellation signal
     * @return Run summary, or a PersistenceException / InvalidRequestException
     */
    public Mono<BackfillResult> backfillTags(BackfillRequest request, BackfillCancellation cancellation) {
        if (request == null || request.getOwnerSubject() == null || request.getOwnerSubject().isBlank()) {
            return Mono.error(new InvalidRequestException("Owner subject is required"));
        }
        if (properties.getCheckpointInterval() < 1) {
            return Mono.error(new IllegalStateException("Checkpoint interval must be at least 1"));
        }

        return Mono.defer(() -> {
            NoteStore store = noteStoreFactory.open();
            Run run = new Run(request.getOwnerSubject(), properties.getCheckpointInterval());
            log.info("Starting tag backfill for owner {} (onlyMissing={})",
                    run.ownerSubject, request.isOnlyMissing());

            return store.query(request.getOwnerSubject(), request.isOnlyMissing())
                    .collectList()
                    .flatMap(candidates -> {
                        run.total = candidates.size();
                        return Flux.fromIterable(candidates)
                                .concatMap(note -> Mono.defer(() -> cancellation.isCancelled()
                                        ? Mono.<Void>empty()
                                        : processNote(note, store, run, cancellation)))
                                .then(Mono.defer(store::commit))
                                .then(Mono.fromSupplier(() -> run.toResult(cancellation.isCancelled())));
                    })
                    .doOnSuccess(result -> log.info(
                            "Tag backfill for owner {} finished in {} ms: {}/{} processed, {} error(s){}",
                            run.ownerSubject, run.elapsed().toMillis(), result.getProcessedCount(),
                            result.getTotalNotes(), result.getErrors().size(),
                            result.isCancelled() ? " (cancelled)" : ""))
                    .doOnError(PersistenceException.class, error -> log.error(
                            "Tag backfill for owner {} aborted after {} processed note(s): {}",
                            run.ownerSubject, run.processed, error.getMessage()));
        });
    }

    private Mono<Void> processNote(Note note, NoteStore store, Run run, BackfillCancellation cancellation) {
        return tagsFor(note, cancellation)
                .onErrorResume(error -> {
                    String message = "Failed to generate tags for note '" + note.getTitle() + "': " + causeOf(error);
                    log.warn(message);
                    run.errors.add(message);
                    return Mono.empty();
                })
                .flatMap(tags -> {
                    note.setTags(tags);
                    note.setUpdatedAt(LocalDateTime.now(clock));
                    run.processed++;
                    return checkpointIfDue(store, run);
                });
    }

    private Mono<String> tagsFor(Note note, BackfillCancellation cancellation) {
        Mono<String> call = Mono.defer(() -> enrichmentClient.generateTags(note.getTitle(), note.getContent()));

        if (properties.getMaxRetries() > 0) {
            call = call.retryWhen(Retry.fixedDelay(properties.getMaxRetries(), properties.getRetryBackoff())
                    .filter(EnrichmentException.class::isInstance)
                    .doBeforeRetry(signal -> log.debug("Retrying tags for note {} (attempt {})",
                            note.getId(), signal.totalRetries() + 1))
                    .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
        }

        // an empty reply only means "skip" when the run was cancelled
        return call.takeUntilOther(cancellation.asMono())
                .switchIfEmpty(Mono.defer(() -> cancellation.isCancelled()
                        ? Mono.<String>empty()
                        : Mono.error(new EnrichmentException("malformed response: empty reply"))));
    }

    private Mono<Void> checkpointIfDue(NoteStore store, Run run) {
        if (run.processed % run.checkpointInterval != 0) {
            return Mono.empty();
        }
        log.debug("Checkpoint for owner {} at {} processed note(s)", run.ownerSubject, run.processed);
        return store.commit();
    }

    private static String causeOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    /**
     * Mutable progress of a single run. Confined to the run's sequential pipeline.
     */
    private static final class Run {

        private final String ownerSubject;
        private final int checkpointInterval;
        private final long startedAt = System.nanoTime();
        private final List<String> errors = new ArrayList<>();
        private int processed;
        private int total;

        private Run(String ownerSubject, int checkpointInterval) {
            this.ownerSubject = ownerSubject;
            this.checkpointInterval = checkpointInterval;
        }

        private Duration elapsed() {
            return Duration.ofNanos(System.nanoTime() - startedAt);
        }

        private BackfillResult toResult(boolean cancelled) {
            return BackfillResult.builder()
                    .processedCount(processed)
                    .totalNotes(total)
                    .errors(List.copyOf(errors))
                    .cancelled(cancelled)
                    .build();
        }
    }
}
