package com.example.realm.protocol;

public enum MsgType {
    // client -> server
    AUTH,
    MOVE,
    HEADING,
    ATTACK,
    CAST,
    DROP,
    DROP_GOLD,
    USE,
    PICKUP,

    // server -> client
    WELCOME,
    ENTITY_MOVED,
    ENTITY_SPAWNED,
    ENTITY_DESPAWNED,
    STAT_CHANGED,
    ITEM_SPAWNED,
    ITEM_REMOVED,
    ITEM_CHANGED,
    COMBAT,
    INVENTORY,
    REJECTED,
    ERROR
}
