package com.wifi.roaming.service;

import com.wifi.roaming.config.RoamingProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Persistence lifecycle of the tracker: load on startup, periodic save and retention, final save
 * on shutdown. Runs on its own cadence, independent of the poll interval.
 */
@Service
public class RoamingMaintenanceService {

    private static final Logger logger = LoggerFactory.getLogger(RoamingMaintenanceService.class);

    private final RoamingTracker roamingTracker;
    private final RoamingProperties properties;

    public RoamingMaintenanceService(RoamingTracker roamingTracker, RoamingProperties properties) {
        this.roamingTracker = roamingTracker;
        this.properties = properties;
    }

    @PostConstruct
    public void initialize() {
        logger.info("Initializing roaming state: maxHistoryDays={}, profileInactivityDays={}, "
                        + "saveInterval={} ms, cleanupInterval={} ms",
                properties.getMaxHistoryDays(),
                properties.getProfileInactivityDays(),
                properties.getPersistence().getSaveIntervalMs(),
                properties.getPersistence().getCleanupIntervalMs());
        roamingTracker.loadState();
    }

    @Scheduled(fixedDelayString = "${roaming.persistence.save-interval-ms:300000}",
            initialDelayString = "${roaming.persistence.save-interval-ms:300000}")
    public void persistState() {
        roamingTracker.saveState();
    }

    @Scheduled(fixedDelayString = "${roaming.persistence.cleanup-interval-ms:3600000}",
            initialDelayString = "${roaming.persistence.cleanup-interval-ms:3600000}")
    public void cleanupOldData() {
        roamingTracker.cleanupOldData();
    }

    @PreDestroy
    public void shutdown() {
        logger.info("Saving roaming state before shutdown");
        if (!roamingTracker.saveState()) {
            logger.warn("Roaming state could not be saved on shutdown; changes since the last save are lost");
        }
    }
}
