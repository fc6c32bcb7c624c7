package com.ainotes.store;

import com.ainotes.repository.NoteRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.reactive.TransactionalOperator;

/**
 * Opens a fresh {@link R2dbcNoteStore} per caller.
 */
@Component
@RequiredArgsConstructor
public class R2dbcNoteStoreFactory implements NoteStoreFactory {

    private final NoteRepository noteRepository;
    private final TransactionalOperator transactionalOperator;

    @Override
    public NoteStore open() {
        return new R2dbcNoteStore(noteRepository, transactionalOperator);
    }
}
