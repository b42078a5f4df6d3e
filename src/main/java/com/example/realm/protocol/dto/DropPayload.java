package com.example.realm.protocol.dto;

public class DropPayload {
    public int slot;
    public int qty = 1;
}
