package com.wifi.roaming.health;

import com.wifi.roaming.dto.TrackerStatistics;
import com.wifi.roaming.service.RoamingStatePersistenceService;
import com.wifi.roaming.service.RoamingStatePersistenceService.PersistenceStatus;
import com.wifi.roaming.service.RoamingTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for roaming state durability.
 *
 * <p><strong>Health Status Criteria:</strong>
 * <ul>
 *   <li><strong>UP:</strong> the last save succeeded, or no save has been attempted yet</li>
 *   <li><strong>DOWN:</strong> the last save failed; tracking continues in memory until the store recovers</li>
 * </ul>
 */
@Component("roamingStateStore")
public class RoamingStateStoreHealthIndicator implements HealthIndicator {

    private static final Logger logger = LoggerFactory.getLogger(RoamingStateStoreHealthIndicator.class);

    private static final String STORE_KEY = "store";
    private static final String REASON_KEY = "reason";

    private final RoamingStatePersistenceService persistenceService;
    private final RoamingTracker roamingTracker;

    public RoamingStateStoreHealthIndicator(RoamingStatePersistenceService persistenceService,
                                            RoamingTracker roamingTracker) {
        this.persistenceService = persistenceService;
        this.roamingTracker = roamingTracker;
    }

    @Override
    public Health health() {
        try {
            PersistenceStatus status = persistenceService.getStatus();
            TrackerStatistics statistics = roamingTracker.getStatistics();

            Health.Builder builder = status.isHealthy() ? Health.up() : Health.down();
            builder.withDetail(STORE_KEY, status.store())
                    .withDetail("consecutiveFailures", status.consecutiveFailures())
                    .withDetail("activeDevices", statistics.activeDevices())
                    .withDetail("trackedDevices", statistics.totalDevices())
                    .withDetail("retainedEvents", statistics.totalEvents());

            if (status.lastSuccess() != null) {
                builder.withDetail("lastSuccessfulSave", status.lastSuccess().toString());
            }
            if (status.lastFailure() != null) {
                builder.withDetail("lastFailedSave", status.lastFailure().toString());
                builder.withDetail("lastError", String.valueOf(status.lastError()));
            }
            builder.withDetail(REASON_KEY, status.isHealthy()
                    ? "Roaming state store is accepting writes"
                    : "Last roaming state save failed; state is held in memory only");

            return builder.build();
        } catch (Exception e) {
            logger.error("Roaming state store health check failed", e);
            return Health.down()
                    .withDetail("error", e.getMessage())
                    .withDetail("errorType", e.getClass().getSimpleName())
                    .withDetail(REASON_KEY, "Roaming state store health check failed: " + e.getMessage())
                    .build();
        }
    }
}
