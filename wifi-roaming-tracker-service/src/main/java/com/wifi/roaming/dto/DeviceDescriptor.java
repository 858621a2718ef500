package com.wifi.roaming.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One device as reported by a router during a poll cycle.
 *
 * <p>The MAC address is the stable device identifier. Descriptors without one are rejected by
 * {@link com.wifi.roaming.service.SnapshotValidationService} before they reach the tracker.
 *
 * @param macAddress MAC address of the station
 * @param hostname host name the router knows the device by, may be empty
 * @param ipAddress current IP address, may be empty
 * @param signalStrength signal strength on the router's scale (higher is better)
 * @param medium connection medium
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DeviceDescriptor(
        @JsonProperty("mac_address") String macAddress,
        @JsonProperty("hostname") String hostname,
        @JsonProperty("ip_address") String ipAddress,
        @JsonProperty("signal_strength") int signalStrength,
        @JsonProperty("medium") ConnectionMedium medium) {

    public DeviceDescriptor {
        hostname = hostname == null ? "" : hostname;
        ipAddress = ipAddress == null ? "" : ipAddress;
        medium = medium == null ? ConnectionMedium.WIFI : medium;
    }

    /**
     * Returns a copy carrying the given MAC address, used after normalisation.
     */
    public DeviceDescriptor withMacAddress(String normalizedMac) {
        return new DeviceDescriptor(normalizedMac, hostname, ipAddress, signalStrength, medium);
    }
}
