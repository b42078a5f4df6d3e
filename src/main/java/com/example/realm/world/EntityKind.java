package com.example.realm.world;

public enum EntityKind {
    PLAYER(true),
    NPC(true),
    ITEM(false);

    private final boolean blocking;

    EntityKind(boolean blocking) {
        this.blocking = blocking;
    }

    public boolean isBlocking() {
        return blocking;
    }
}
