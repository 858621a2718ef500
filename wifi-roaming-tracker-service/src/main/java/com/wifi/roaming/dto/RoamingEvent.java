package com.wifi.roaming.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one association transition.
 *
 * <p>A {@code roam} always names two different routers, a {@code connect} has an empty
 * {@code from_router} and a {@code disconnect} an empty {@code to_router}. The constructor
 * rejects any other combination.
 *
 * @param timestamp instant of the poll cycle that observed the transition
 * @param macAddress device MAC address
 * @param hostname device host name
 * @param ipAddress device IP address
 * @param fromRouter router the device left, empty for a connect
 * @param toRouter router the device joined, empty for a disconnect
 * @param eventType transition kind
 * @param signalBefore last signal reading of the session that ended, 0 when not applicable
 * @param signalAfter first signal reading of the new session, 0 when not applicable
 * @param sessionDuration duration in seconds of the session that ended, null for a connect
 * @param triggerReason heuristic explanation of the transition
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoamingEvent(
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("mac_address") String macAddress,
        @JsonProperty("hostname") String hostname,
        @JsonProperty("ip_address") String ipAddress,
        @JsonProperty("from_router") String fromRouter,
        @JsonProperty("to_router") String toRouter,
        @JsonProperty("event_type") RoamingEventType eventType,
        @JsonProperty("signal_before") int signalBefore,
        @JsonProperty("signal_after") int signalAfter,
        @JsonProperty("session_duration") Double sessionDuration,
        @JsonProperty("trigger_reason") String triggerReason) {

    public RoamingEvent {
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(eventType, "event type is required");
        if (macAddress == null || macAddress.isBlank()) {
            throw new IllegalArgumentException("MAC address is required");
        }
        hostname = hostname == null ? "" : hostname;
        ipAddress = ipAddress == null ? "" : ipAddress;
        fromRouter = fromRouter == null ? "" : fromRouter;
        toRouter = toRouter == null ? "" : toRouter;
        triggerReason = triggerReason == null ? "" : triggerReason;

        switch (eventType) {
            case ROAM -> {
                if (fromRouter.isEmpty() || toRouter.isEmpty() || fromRouter.equals(toRouter)) {
                    throw new IllegalArgumentException(
                            "Roam requires two different routers, got '" + fromRouter + "' -> '" + toRouter + "'");
                }
            }
            case CONNECT -> {
                if (!fromRouter.isEmpty() || toRouter.isEmpty()) {
                    throw new IllegalArgumentException("Connect requires an empty from_router and a to_router");
                }
            }
            case DISCONNECT -> {
                if (fromRouter.isEmpty() || !toRouter.isEmpty()) {
                    throw new IllegalArgumentException("Disconnect requires a from_router and an empty to_router");
                }
            }
        }
    }

    public static RoamingEvent connect(Instant timestamp, DeviceDescriptor device, String router) {
        return new RoamingEvent(timestamp, device.macAddress(), device.hostname(), device.ipAddress(),
                "", router, RoamingEventType.CONNECT, 0, device.signalStrength(), null,
                TriggerReason.NEW_CONNECTION.getCode());
    }

    public static RoamingEvent roam(Instant timestamp, DeviceDescriptor device, String fromRouter, String toRouter,
                                    int signalBefore, double priorSessionDuration, TriggerReason reason) {
        return new RoamingEvent(timestamp, device.macAddress(), device.hostname(), device.ipAddress(),
                fromRouter, toRouter, RoamingEventType.ROAM, signalBefore, device.signalStrength(),
                priorSessionDuration, reason.getCode());
    }

    public static RoamingEvent disconnect(Instant timestamp, String macAddress, String hostname, String ipAddress,
                                          String fromRouter, int signalBefore, double sessionDuration) {
        return new RoamingEvent(timestamp, macAddress, hostname, ipAddress, fromRouter, "",
                RoamingEventType.DISCONNECT, signalBefore, 0, sessionDuration,
                TriggerReason.DISCONNECTED.getCode());
    }

    @JsonIgnore
    public boolean isRoam() {
        return eventType == RoamingEventType.ROAM;
    }

    public boolean involves(String mac) {
        return macAddress.equalsIgnoreCase(mac);
    }
}
