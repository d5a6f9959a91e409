package com.costtracker.costs.exception;

/**
 * The record store or the report cache could not be reached. Fatal for the current
 * request; callers retry the whole request.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
