package com.commandcenter.backend.domain;

/** Ephemeral agent status line. Broadcast only, never stored. */
public record StatusUpdate(
        String type,
        String agent,
        String status,
        String detail,
        String timestamp
) {}
