package com.costtracker.costs.exception;

/**
 * Malformed request input, detected before any storage access. {@code errorId} is the
 * numeric error code returned to clients.
 */
public class InvalidInputException extends IllegalArgumentException {

    private final int errorId;

    public InvalidInputException(int errorId, String message) {
        super(message);
        this.errorId = errorId;
    }

    public int getErrorId() {
        return errorId;
    }
}
