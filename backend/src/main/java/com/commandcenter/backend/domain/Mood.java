package com.commandcenter.backend.domain;

public record Mood(
        String mood,
        String lastUpdated
) {
    public static Mood empty() {
        return new Mood(null, null);
    }
}
