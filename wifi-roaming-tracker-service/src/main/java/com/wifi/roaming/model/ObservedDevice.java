package com.wifi.roaming.model;

import com.wifi.roaming.dto.DeviceDescriptor;

/**
 * A validated descriptor together with the router that reported it in the current cycle.
 */
public record ObservedDevice(String routerName, DeviceDescriptor device) {

    public String macAddress() {
        return device.macAddress();
    }
}
