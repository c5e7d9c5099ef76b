package com.commandcenter.backend.domain.memory;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MemoryGoal(
        Object id,
        String text,
        String deadline,
        String status,
        Object priority,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("completed_at") String completedAt
) {}
