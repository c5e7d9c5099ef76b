package com.commandcenter.backend.domain.memory;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MemoryPreference(String key, String value, @JsonProperty("updated_at") String updatedAt) {}
