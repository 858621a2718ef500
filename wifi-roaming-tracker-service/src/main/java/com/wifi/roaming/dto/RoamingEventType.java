package com.wifi.roaming.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of association transition recorded in the event log.
 */
public enum RoamingEventType {
    CONNECT("connect"),
    DISCONNECT("disconnect"),
    ROAM("roam");

    private final String code;

    RoamingEventType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static RoamingEventType fromCode(String code) {
        for (RoamingEventType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown roaming event type: " + code);
    }
}
