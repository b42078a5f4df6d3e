package com.example.realm.error;

/** Bad command arguments. Nothing was changed. */
public class ValidationException extends GameException {
    public ValidationException(String reason) {
        super(reason);
    }
}
