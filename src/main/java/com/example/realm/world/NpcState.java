package com.example.realm.world;

public enum NpcState {
    IDLE,
    AGGROED,
    ATTACKING,
    DEAD,
    RESPAWNING;

    public boolean isAlive() {
        return this != DEAD && this != RESPAWNING;
    }
}
