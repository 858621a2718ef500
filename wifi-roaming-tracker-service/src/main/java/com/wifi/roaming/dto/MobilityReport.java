package com.wifi.roaming.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Composite view of the tracker state for presentation layers.
 */
public record MobilityReport(
        @JsonProperty("generated_at") Instant generatedAt,
        @JsonProperty("statistics") TrackerStatistics statistics,
        @JsonProperty("active_sessions") List<SessionSnapshot> activeSessions,
        @JsonProperty("recent_events") List<RoamingEvent> recentEvents,
        @JsonProperty("device_profiles") List<DeviceProfile> deviceProfiles,
        @JsonProperty("router_statistics") List<RouterStatistics> routerStatistics) {
}
