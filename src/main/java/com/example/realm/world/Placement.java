package com.example.realm.world;

import com.example.realm.error.OccupancyConflictException;
import com.example.realm.error.ValidationException;

public enum Placement {
    OK("ok"),
    UNKNOWN_MAP("unknown map"),
    OUT_OF_BOUNDS("out of bounds"),
    BLOCKED("tile is blocked"),
    OCCUPIED("tile is occupied"),
    TILE_FULL("too many items on this tile"),
    UNKNOWN_ENTITY("no such entity"),
    ALREADY_PRESENT("already in the world");

    private final String reason;

    Placement(String reason) {
        this.reason = reason;
    }

    public boolean isOk() {
        return this == OK;
    }

    public String reason() {
        return reason;
    }

    /**
     * @throws OccupancyConflictException for an occupied or full tile
     * @throws ValidationException for every other failure
     */
    public void requireOk() {
        if (this == OK) return;
        if (this == OCCUPIED || this == TILE_FULL) throw new OccupancyConflictException(reason);
        throw new ValidationException(reason);
    }
}
