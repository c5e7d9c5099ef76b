package com.commandcenter.backend.domain.memory;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MemoryConversation(
        Object id,
        String role,
        String content,
        String channel,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("created_at") String createdAt
) {}
