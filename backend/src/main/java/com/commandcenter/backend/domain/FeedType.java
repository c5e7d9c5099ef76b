package com.commandcenter.backend.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum FeedType {
    THINKING("thinking"),
    WORKING("working"),
    AGENT_SPAWNED("agent-spawned"),
    AGENT_COMPLETED("agent-completed"),
    AGENT_FAILED("agent-failed"),
    VALIDATING("validating"),
    DECISION("decision"),
    ERROR("error"),
    COMPLETED("completed");

    private final String wire;

    FeedType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public static Optional<FeedType> fromWire(String value) {
        return Arrays.stream(values()).filter(t -> t.wire.equals(value)).findFirst();
    }

    /** Wire names, sorted, for error messages. */
    public static String validNames() {
        return String.join(", ", Arrays.stream(values()).map(FeedType::wire).sorted().toList());
    }
}
