package com.ecgheartbeat.backend.entity;

import lombok.Getter;

@Getter
public enum EcgStatus {
    NORMAL("Normal"),
    ABNORMAL("Abnormal");

    private final String label;

    EcgStatus(String label) {
        this.label = label;
    }
}
