package com.commandcenter.backend.domain;

public record ActivityEntry(
        String timestamp,
        String message
) {}
