package com.wifi.roaming.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Physical medium a device uses to reach its router.
 */
public enum ConnectionMedium {
    WIFI("wifi"),
    ETHERNET("ethernet"),
    GUEST("guest");

    private final String code;

    ConnectionMedium(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Resolves a medium from its wire code. Unknown or missing values fall back to WIFI,
     * which is what the routers report for wireless stations without an explicit interface type.
     */
    @JsonCreator
    public static ConnectionMedium fromCode(String code) {
        if (code == null) {
            return WIFI;
        }
        for (ConnectionMedium medium : values()) {
            if (medium.code.equalsIgnoreCase(code.trim())) {
                return medium;
            }
        }
        return WIFI;
    }
}
