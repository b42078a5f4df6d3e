package com.example.realm.protocol.dto;

public class CastPayload {
    public int spellId;
    public long targetId;
}
