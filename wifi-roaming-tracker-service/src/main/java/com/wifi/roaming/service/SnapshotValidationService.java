package com.wifi.roaming.service;

import com.wifi.roaming.dto.DeviceDescriptor;
import com.wifi.roaming.exception.InvalidDeviceDescriptorException;
import com.wifi.roaming.model.ObservedDevice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Boundary checks for poll snapshots.
 *
 * <p>Turns the router to device-list mapping produced by the external poller into one entry per
 * device, keyed by normalised MAC address, in snapshot iteration order. Malformed entries are
 * skipped with a warning so one bad descriptor never aborts a whole cycle.
 */
@Service
public class SnapshotValidationService {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotValidationService.class);

    private final RoamingMetricsService metricsService;

    public SnapshotValidationService(RoamingMetricsService metricsService) {
        this.metricsService = metricsService;
    }

    /**
     * Flattens a snapshot into {@code MAC -> (router, descriptor)}.
     * When two routers report the same MAC the later report wins.
     */
    public Map<String, ObservedDevice> flatten(Map<String, List<DeviceDescriptor>> snapshot) {
        Map<String, ObservedDevice> current = new LinkedHashMap<>();
        if (snapshot == null) {
            return current;
        }

        for (Map.Entry<String, List<DeviceDescriptor>> entry : snapshot.entrySet()) {
            String routerName = entry.getKey();
            List<DeviceDescriptor> devices = entry.getValue();
            if (devices == null) {
                continue;
            }
            for (DeviceDescriptor device : devices) {
                try {
                    ObservedDevice observed = validate(routerName, device);
                    ObservedDevice previous = current.put(observed.macAddress(), observed);
                    if (previous != null && !previous.routerName().equals(observed.routerName())) {
                        logger.warn("Device {} reported by both {} and {} in one snapshot, keeping {}",
                                observed.macAddress(), previous.routerName(), observed.routerName(),
                                observed.routerName());
                    }
                } catch (InvalidDeviceDescriptorException e) {
                    metricsService.recordRejectedDescriptor();
                    logger.warn("Skipping device entry from router '{}': {}", routerName, e.getMessage());
                }
            }
        }
        return current;
    }

    /**
     * Validates one entry and returns it with a normalised MAC address.
     *
     * @throws InvalidDeviceDescriptorException if the router id, the descriptor or its MAC is missing
     */
    public ObservedDevice validate(String routerName, DeviceDescriptor device) {
        if (routerName == null || routerName.isBlank()) {
            throw new InvalidDeviceDescriptorException("router identifier is missing");
        }
        if (device == null) {
            throw new InvalidDeviceDescriptorException("descriptor is null");
        }
        if (device.macAddress() == null || device.macAddress().isBlank()) {
            throw new InvalidDeviceDescriptorException(
                    "descriptor for host '" + device.hostname() + "' has no MAC address");
        }
        return new ObservedDevice(routerName, device.withMacAddress(normalizeMac(device.macAddress())));
    }

    /**
     * Upper-cases a MAC address and uses colons as separators, so "aa-bb-..." and "AA:BB:..." match.
     */
    public String normalizeMac(String macAddress) {
        if (macAddress == null) {
            return null;
        }
        return macAddress.trim().toUpperCase(Locale.ROOT).replace('-', ':');
    }
}
