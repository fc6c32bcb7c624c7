package com.ainotes.exception;

/**
 * Thrown when the note store could not commit pending changes.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
