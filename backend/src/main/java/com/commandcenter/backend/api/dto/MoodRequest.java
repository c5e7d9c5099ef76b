package com.commandcenter.backend.api.dto;

import jakarta.validation.constraints.NotNull;

public class MoodRequest {
    @NotNull
    public String mood;
}
