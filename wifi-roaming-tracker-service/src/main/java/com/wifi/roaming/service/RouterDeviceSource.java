package com.wifi.roaming.service;

import com.wifi.roaming.dto.DeviceDescriptor;

import java.util.List;
import java.util.Map;

/**
 * External poller that asks every router for its currently associated devices.
 *
 * <p>Router access is outside this service. Register an implementation as a bean and
 * {@link RoamingPollingService} feeds its snapshots to the tracker once per poll interval.
 */
@FunctionalInterface
public interface RouterDeviceSource {

    /**
     * One poll cycle's view of the network.
     *
     * @return router identifier to the devices currently associated with it, in router order
     */
    Map<String, List<DeviceDescriptor>> fetchSnapshot();
}
