package com.critter.exception;

/**
 * The coordination store could not be reached. Fatal for the current call; the caller may retry later.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
