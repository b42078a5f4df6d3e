package com.example.realm.error;

/** Static content is missing or inconsistent; the server must not start. */
public class FatalStartupException extends RuntimeException {
    public FatalStartupException(String message) {
        super(message);
    }

    public FatalStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
