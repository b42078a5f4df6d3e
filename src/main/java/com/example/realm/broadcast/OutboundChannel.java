package com.example.realm.broadcast;

import com.example.realm.protocol.WorldEvent;

/**
 * Per-session sink for outbound deltas. Implementations must not block the caller on network I/O.
 */
@FunctionalInterface
public interface OutboundChannel {
    void deliver(WorldEvent event);
}
