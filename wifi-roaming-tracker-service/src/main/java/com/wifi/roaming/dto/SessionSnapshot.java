package com.wifi.roaming.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wifi.roaming.model.SignalTrend;

import java.time.Instant;

/**
 * Read-only view of an open device session.
 */
public record SessionSnapshot(
        @JsonProperty("mac_address") String macAddress,
        @JsonProperty("hostname") String hostname,
        @JsonProperty("ip_address") String ipAddress,
        @JsonProperty("router_name") String routerName,
        @JsonProperty("medium") ConnectionMedium medium,
        @JsonProperty("start_time") Instant startTime,
        @JsonProperty("current_signal") int currentSignal,
        @JsonProperty("average_signal") double averageSignal,
        @JsonProperty("signal_trend") SignalTrend signalTrend,
        @JsonProperty("sample_count") int sampleCount) {
}
