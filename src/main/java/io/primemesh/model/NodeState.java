package io.primemesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NodeState {
    FOLLOWER("follower"),
    CANDIDATE("candidate"),
    LEADER("leader"),
    DISCONNECTED("disconnected");

    private final String wireName;

    NodeState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static NodeState fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return FOLLOWER;
        }
        for (NodeState value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown node state: " + raw);
    }
}
