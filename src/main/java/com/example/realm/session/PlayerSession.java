package com.example.realm.session;

import com.example.realm.broadcast.OutboundChannel;

public record PlayerSession(long userId, long playerId, OutboundChannel channel, long loggedInAt) {}
