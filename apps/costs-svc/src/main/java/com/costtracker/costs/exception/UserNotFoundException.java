package com.costtracker.costs.exception;

public class UserNotFoundException extends RuntimeException {

    public static final int ERROR_ID = 7;

    private final long userId;

    public UserNotFoundException(long userId) {
        super("User not found");
        this.userId = userId;
    }

    public long getUserId() {
        return userId;
    }
}
