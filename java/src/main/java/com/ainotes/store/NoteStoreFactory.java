package com.ainotes.store;

/**
 * Opens independent {@link NoteStore} handles.
 */
@FunctionalInterface
public interface NoteStoreFactory {

    NoteStore open();
}
