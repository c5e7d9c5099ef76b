package com.commandcenter.backend.domain;

public record FeedEntry(
        String id,
        String message,
        FeedType type,
        String timestamp
) {}
