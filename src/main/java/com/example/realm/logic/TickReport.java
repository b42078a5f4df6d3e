package com.example.realm.logic;

public record TickReport(long tick, int applied, int failed, long durationMs) {}
