package com.example.realm.world;

public enum Heading {
    NORTH(0, -1),
    EAST(1, 0),
    SOUTH(0, 1),
    WEST(-1, 0);

    public final int dx;
    public final int dy;

    Heading(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    /** Cardinal heading of a unit step, or {@code fallback} when the step is not cardinal. */
    public static Heading of(int dx, int dy, Heading fallback) {
        for (Heading h : values()) {
            if (h.dx == dx && h.dy == dy) return h;
        }
        return fallback;
    }
}
