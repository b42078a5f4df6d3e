package com.example.realm.protocol.dto;

public class TargetPayload {
    public long targetId;
}
