package com.example.realm.protocol.dto;

public class AuthPayload {
    public long userId;
    public String name;
}
