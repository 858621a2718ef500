package com.wifi.roaming.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of recent signal change within a session.
 */
public enum SignalTrend {
    IMPROVING("improving"),
    DEGRADING("degrading"),
    STABLE("stable");

    private final String code;

    SignalTrend(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
