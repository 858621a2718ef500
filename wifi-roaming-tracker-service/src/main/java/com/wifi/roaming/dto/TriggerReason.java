package com.wifi.roaming.dto;

/**
 * Reasons attached to roaming events. The first five are the roam heuristics,
 * the last two label connects and disconnects.
 */
public enum TriggerReason {
    WEAK_SIGNAL("weak_signal"),
    SIGNAL_DEGRADING("signal_degrading"),
    BETTER_SIGNAL("better_signal"),
    QUICK_HANDOVER("quick_handover"),
    UNKNOWN("unknown"),
    NEW_CONNECTION("new_connection"),
    DISCONNECTED("disconnected");

    private final String code;

    TriggerReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
