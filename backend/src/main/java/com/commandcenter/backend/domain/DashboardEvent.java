package com.commandcenter.backend.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DashboardEvent(
        EventType type,
        Object data
) {
    public static DashboardEvent of(EventType type) {
        return new DashboardEvent(type, null);
    }
}
