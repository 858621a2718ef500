package com.wifi.roaming.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Continuously updated mobility summary for one device, keyed by MAC address.
 *
 * <p>Profiles are mutated by {@link com.wifi.roaming.service.RoamingTracker} on every event
 * involving the device and are only removed by retention pruning.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeviceProfile {

    @JsonProperty("mac_address")
    private String macAddress;

    @JsonProperty("hostname")
    private String hostname;

    @JsonProperty("mobility_pattern")
    private MobilityPattern mobilityPattern = MobilityPattern.STATIC;

    /**
     * Every router the device has been associated with.
     */
    @JsonProperty("routers")
    private Set<String> routers = new LinkedHashSet<>();

    /**
     * Roams per hour over the trailing 24 hours.
     */
    @JsonProperty("roaming_frequency")
    private double roamingFrequency;

    /**
     * Mean duration in seconds of the device's closed sessions.
     */
    @JsonProperty("average_session_duration")
    private double averageSessionDuration;

    @JsonProperty("total_roams")
    private int totalRoams;

    @JsonProperty("current_router")
    private String currentRouter = "";

    @JsonProperty("first_seen")
    private Instant firstSeen;

    @JsonProperty("last_seen")
    private Instant lastSeen;

    public static DeviceProfile firstSeen(String macAddress, String hostname, Instant now) {
        DeviceProfile profile = new DeviceProfile();
        profile.setMacAddress(macAddress);
        profile.setHostname(hostname);
        profile.setFirstSeen(now);
        profile.setLastSeen(now);
        return profile;
    }

    /**
     * Detached copy handed out by queries so callers never see later mutations.
     */
    public DeviceProfile copy() {
        DeviceProfile copy = new DeviceProfile();
        copy.setMacAddress(macAddress);
        copy.setHostname(hostname);
        copy.setMobilityPattern(mobilityPattern);
        copy.setRouters(new LinkedHashSet<>(routers));
        copy.setRoamingFrequency(roamingFrequency);
        copy.setAverageSessionDuration(averageSessionDuration);
        copy.setTotalRoams(totalRoams);
        copy.setCurrentRouter(currentRouter);
        copy.setFirstSeen(firstSeen);
        copy.setLastSeen(lastSeen);
        return copy;
    }
}
