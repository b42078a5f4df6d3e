package com.example.realm.logic.combat;

import com.example.realm.world.GroundItem;

import java.util.List;

public record KillReport(long npcId, long killerId, List<RewardCalculator.Share> shares, List<GroundItem> drops, long respawnAt) {}
