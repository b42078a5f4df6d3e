package com.example.realm.content;

public record SpellTemplate(int id, String name, Kind kind, int manaCost, int range, int minPower, int maxPower) {
    public enum Kind {
        DAMAGE,
        HEAL
    }

    public SpellTemplate {
        if (maxPower < minPower) maxPower = minPower;
    }
}
