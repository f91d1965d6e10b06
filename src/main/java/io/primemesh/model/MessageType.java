package io.primemesh.model;

public enum MessageType {
    HEARTBEAT("heartbeat"),
    VOTE_REQUEST("vote_request"),
    LEADER_ANNOUNCEMENT("leader_announcement"),
    UNKNOWN("unknown");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static MessageType fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        for (MessageType value : values()) {
            if (value != UNKNOWN && value.wireName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
