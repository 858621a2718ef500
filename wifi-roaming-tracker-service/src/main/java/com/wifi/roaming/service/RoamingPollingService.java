package com.wifi.roaming.service;

import com.wifi.roaming.config.RoamingProperties;
import com.wifi.roaming.dto.DeviceDescriptor;
import com.wifi.roaming.dto.RoamingEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Fixed-delay poll loop feeding router snapshots into the {@link RoamingTracker}.
 *
 * <p>Idle when no {@link RouterDeviceSource} bean is registered. A failed cycle is logged and
 * dropped as a whole; the next cycle starts again from fresh data.
 */
@Slf4j
@Service
public class RoamingPollingService {

    private final ObjectProvider<RouterDeviceSource> sourceProvider;
    private final RoamingTracker roamingTracker;
    private final RoamingProperties properties;

    public RoamingPollingService(ObjectProvider<RouterDeviceSource> sourceProvider,
                                 RoamingTracker roamingTracker,
                                 RoamingProperties properties) {
        this.sourceProvider = sourceProvider;
        this.roamingTracker = roamingTracker;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${roaming.polling.interval-ms:30000}",
            initialDelayString = "${roaming.polling.interval-ms:30000}")
    public void scheduledPoll() {
        if (properties.getPolling().isEnabled()) {
            pollOnce();
        }
    }

    /**
     * Runs a single poll cycle.
     *
     * @return true if a snapshot was fetched and applied
     */
    public boolean pollOnce() {
        RouterDeviceSource source = sourceProvider.getIfAvailable();
        if (source == null) {
            log.debug("No RouterDeviceSource registered, skipping poll cycle");
            return false;
        }

        try {
            Map<String, List<DeviceDescriptor>> snapshot = source.fetchSnapshot();
            List<RoamingEvent> emitted = roamingTracker.updateDeviceLocations(snapshot);
            log.debug("Poll cycle applied {} routers, {} events", snapshot == null ? 0 : snapshot.size(), emitted.size());
            return true;
        } catch (RuntimeException e) {
            log.error("Roaming poll cycle failed, retrying with fresh data next cycle: {}", e.getMessage(), e);
            return false;
        }
    }
}
