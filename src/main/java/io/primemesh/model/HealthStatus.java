package io.primemesh.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HealthStatus {
    HEALTHY("healthy"),
    UNHEALTHY("unhealthy");

    private final String wireName;

    HealthStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
