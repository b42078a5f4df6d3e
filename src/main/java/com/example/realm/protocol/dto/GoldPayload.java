package com.example.realm.protocol.dto;

public class GoldPayload {
    public int qty;
}
