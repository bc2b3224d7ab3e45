package com.ecgheartbeat.backend.storage;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DatabaseStatus {
    CONNECTED("connected"),
    CONFIGURED_BUT_UNREACHABLE("configured but not connected"),
    NOT_CONFIGURED("not configured");

    private final String label;

    DatabaseStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
