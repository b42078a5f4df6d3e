package com.example.realm.protocol.dto;

public class SlotPayload {
    public int slot;
}
