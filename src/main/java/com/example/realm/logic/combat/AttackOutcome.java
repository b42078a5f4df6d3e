package com.example.realm.logic.combat;

public record AttackOutcome(boolean hit, boolean critical, int damage) {
    public static final AttackOutcome MISS = new AttackOutcome(false, false, 0);
}
