package com.example.realm.protocol.dto;

import com.example.realm.world.Heading;

public class HeadingPayload {
    public Heading heading;
}
