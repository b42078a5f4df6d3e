package com.example.realm.logic.combat;

import com.example.realm.world.Player;

/** Player death is resolved by the session layer; combat only reports it. */
@FunctionalInterface
public interface PlayerDeathListener {
    void onPlayerDeath(Player player, long now);
}
