package com.commandcenter.backend.domain.memory;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MemoryFact(Object id, String fact, String category, @JsonProperty("created_at") String createdAt) {}
