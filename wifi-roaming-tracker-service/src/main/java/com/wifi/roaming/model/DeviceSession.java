package com.wifi.roaming.model;

import com.wifi.roaming.dto.ConnectionMedium;
import com.wifi.roaming.dto.DeviceDescriptor;
import com.wifi.roaming.dto.SessionSnapshot;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;

/**
 * One continuous association between a device and a single router.
 *
 * <p>A session is opened when the device is first seen on a router and closed exactly once, on
 * disconnect or when the device roams away. Closed sessions are never reopened.
 */
@Slf4j
@Getter
public class DeviceSession {

    private final String macAddress;
    private final String routerName;
    private final ConnectionMedium medium;
    private final Instant startTime;
    private final SignalSampleBuffer signalSamples = new SignalSampleBuffer();

    private String hostname;
    private String ipAddress;
    private Instant endTime;
    /** Seconds between start and end, null while open. */
    private Double durationSeconds;

    private DeviceSession(DeviceDescriptor device, String routerName, Instant startTime) {
        this.macAddress = device.macAddress();
        this.hostname = device.hostname();
        this.ipAddress = device.ipAddress();
        this.medium = device.medium();
        this.routerName = routerName;
        this.startTime = startTime;
    }

    public static DeviceSession open(DeviceDescriptor device, String routerName, Instant timestamp) {
        DeviceSession session = new DeviceSession(device, routerName, timestamp);
        session.signalSamples.record(timestamp, device.signalStrength());
        return session;
    }

    public void recordSignal(DeviceDescriptor device, Instant timestamp) {
        if (!device.hostname().isEmpty()) {
            this.hostname = device.hostname();
        }
        if (!device.ipAddress().isEmpty()) {
            this.ipAddress = device.ipAddress();
        }
        signalSamples.record(timestamp, device.signalStrength());
    }

    /**
     * Closes the session at the given instant.
     *
     * @return false if the session was already closed, in which case nothing changes
     */
    public boolean close(Instant timestamp) {
        if (isClosed()) {
            log.warn("Ignoring second close of session for {} on {} (closed at {})",
                    macAddress, routerName, endTime);
            return false;
        }
        double seconds = Duration.between(startTime, timestamp).toMillis() / 1000.0;
        if (seconds < 0) {
            log.warn("Negative session duration {}s for {} on {}, clamping to zero (clock skew?)",
                    seconds, macAddress, routerName);
            seconds = 0.0;
        }
        this.endTime = timestamp;
        this.durationSeconds = seconds;
        return true;
    }

    public boolean isClosed() {
        return endTime != null;
    }

    public double averageSignal() {
        return signalSamples.average();
    }

    public SignalTrend signalTrend() {
        return signalSamples.trend();
    }

    public int currentSignal() {
        return signalSamples.latest();
    }

    public SessionSnapshot toSnapshot() {
        return new SessionSnapshot(macAddress, hostname, ipAddress, routerName, medium, startTime,
                currentSignal(), averageSignal(), signalTrend(), signalSamples.size());
    }
}
