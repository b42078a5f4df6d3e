package com.example.realm.content;

import com.example.realm.world.Point;

import java.util.List;

public record MapDefinition(
        int id,
        String name,
        int width,
        int height,
        Point respawn,
        List<Rect> blocked,
        List<Spawn> spawns,
        List<Transition> transitions
) {
    public MapDefinition {
        blocked = blocked == null ? List.of() : List.copyOf(blocked);
        spawns = spawns == null ? List.of() : List.copyOf(spawns);
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
    }

    public record Rect(int x1, int y1, int x2, int y2) {}

    public record Spawn(int npcId, int x, int y, int count) {
        public int countOrOne() {
            return Math.max(1, count);
        }
    }

    /** Stepping on (x, y) moves the player to (toX, toY) on {@code toMap}. */
    public record Transition(int x, int y, int toMap, int toX, int toY) {}
}
