package com.wifi.roaming.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-router association counters.
 *
 * @param routerName router identifier as used in snapshots
 * @param totalConnections sessions opened on the router (connects plus roams in) over the retained log
 * @param activeConnections sessions currently open on the router
 * @param roamsIn roams that ended on the router
 * @param roamsOut roams that left the router
 */
public record RouterStatistics(
        @JsonProperty("router_name") String routerName,
        @JsonProperty("total_connections") int totalConnections,
        @JsonProperty("active_connections") int activeConnections,
        @JsonProperty("roams_in") int roamsIn,
        @JsonProperty("roams_out") int roamsOut) {
}
