package com.commandcenter.backend.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

public record ScheduledItem(
        String id,
        String name,
        String schedule,    // "daily" | "weekly" | ...
        String icon,
        boolean enabled,
        @JsonInclude(JsonInclude.Include.ALWAYS) String lastRun,
        String createdAt
) {}
