package com.wifi.roaming.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Global counters recomputed after every update, cleanup and load.
 *
 * @param totalRoams roam events in the retained log
 * @param totalEvents events of any type in the retained log
 * @param totalDevices devices with a profile
 * @param activeDevices devices with an open session
 * @param roamingDevices devices that roamed within the last 24 hours
 * @param lastUpdate instant of the last recomputation, null before the first one
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrackerStatistics(
        @JsonProperty("total_roams") int totalRoams,
        @JsonProperty("total_events") int totalEvents,
        @JsonProperty("total_devices") int totalDevices,
        @JsonProperty("active_devices") int activeDevices,
        @JsonProperty("roaming_devices") int roamingDevices,
        @JsonProperty("last_update") Instant lastUpdate) {

    public static TrackerStatistics empty() {
        return new TrackerStatistics(0, 0, 0, 0, 0, null);
    }
}
