package com.commandcenter.backend.domain;

import java.util.List;

/** State handed to a subscriber right after it connects. */
public record Snapshot(
        List<Task> tasks,
        List<Agent> agents,
        List<ActivityEntry> activity
) {}
