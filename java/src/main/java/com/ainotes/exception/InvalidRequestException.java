package com.ainotes.exception;

/**
 * Exception thrown for a malformed request, before any store access.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
