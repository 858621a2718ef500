package com.wifi.roaming.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse classification of how often a device roams.
 */
public enum MobilityPattern {
    STATIC("static"),
    MOBILE("mobile"),
    HIGHLY_MOBILE("highly_mobile");

    private final String code;

    MobilityPattern(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static MobilityPattern fromCode(String code) {
        for (MobilityPattern pattern : values()) {
            if (pattern.code.equalsIgnoreCase(code)) {
                return pattern;
            }
        }
        throw new IllegalArgumentException("Unknown mobility pattern: " + code);
    }
}
