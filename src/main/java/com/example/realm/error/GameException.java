package com.example.realm.error;

/**
 * Base type for a rejected player or admin action. The message is short enough to be shown to the
 * originating client as-is.
 */
public abstract class GameException extends RuntimeException {
    protected GameException(String reason) {
        super(reason);
    }

    public String reason() {
        return getMessage();
    }
}
