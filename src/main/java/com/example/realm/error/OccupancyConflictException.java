package com.example.realm.error;

/** The destination tile already holds a blocking occupant or cannot hold more items. */
public class OccupancyConflictException extends GameException {
    public OccupancyConflictException(String reason) {
        super(reason);
    }
}
