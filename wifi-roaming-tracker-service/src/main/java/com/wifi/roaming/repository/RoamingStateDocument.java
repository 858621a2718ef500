package com.wifi.roaming.repository;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.wifi.roaming.dto.DeviceProfile;
import com.wifi.roaming.dto.RoamingEvent;
import com.wifi.roaming.dto.TrackerStatistics;

import java.time.Instant;
import java.util.List;

/**
 * Durable part of the tracker state as written to a {@link RoamingStateStore}.
 * Open sessions are not persisted; they are rebuilt from the next poll cycle.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RoamingStateDocument(
        @JsonProperty("events") List<RoamingEvent> events,
        @JsonProperty("device_profiles") List<DeviceProfile> deviceProfiles,
        @JsonProperty("statistics") TrackerStatistics statistics,
        @JsonProperty("last_updated") Instant lastUpdated) {

    public RoamingStateDocument {
        events = events == null ? List.of() : List.copyOf(events);
        deviceProfiles = deviceProfiles == null ? List.of() : List.copyOf(deviceProfiles);
        statistics = statistics == null ? TrackerStatistics.empty() : statistics;
    }
}
