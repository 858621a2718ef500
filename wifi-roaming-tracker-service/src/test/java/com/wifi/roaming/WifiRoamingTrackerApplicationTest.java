package com.wifi.roaming;

import com.wifi.roaming.health.RoamingStateStoreHealthIndicator;
import com.wifi.roaming.repository.FileRoamingStateStore;
import com.wifi.roaming.repository.RoamingStateStore;
import com.wifi.roaming.service.RoamingPollingService;
import com.wifi.roaming.service.RoamingTracker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static com.wifi.roaming.support.RoamingTestFixtures.LAPTOP_MAC;
import static com.wifi.roaming.support.RoamingTestFixtures.LIVING_ROOM;
import static com.wifi.roaming.support.RoamingTestFixtures.device;
import static com.wifi.roaming.support.RoamingTestFixtures.snapshot;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the full context against the file store configured in application-test.yml.
 */
@SpringBootTest
@ActiveProfiles("test")
class WifiRoamingTrackerApplicationTest {

    @Autowired
    private RoamingTracker roamingTracker;

    @Autowired
    private RoamingStateStore stateStore;

    @Autowired
    private RoamingPollingService pollingService;

    @Autowired
    private RoamingStateStoreHealthIndicator healthIndicator;

    @Test
    void contextLoads_withFileStoreByDefault() {
        assertThat(stateStore).isInstanceOf(FileRoamingStateStore.class);
        assertThat(stateStore.describe()).endsWith("roaming-state.json");
    }

    @Test
    void pollOnce_shouldSkipWithoutRouterDeviceSource() {
        assertThat(pollingService.pollOnce()).isFalse();
    }

    @Test
    void tracker_shouldPersistThroughConfiguredStore() {
        roamingTracker.updateDeviceLocations(snapshot(LIVING_ROOM, device(LAPTOP_MAC, 60)));

        assertThat(roamingTracker.getDeviceCurrentRouter(LAPTOP_MAC)).contains(LIVING_ROOM);
        assertThat(roamingTracker.saveState()).isTrue();
        assertThat(stateStore.load()).hasValueSatisfying(document ->
                assertThat(document.deviceProfiles()).extracting("macAddress").contains(LAPTOP_MAC));
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.UP);
        assertThat(roamingTracker.getRoamingEvents(1, LAPTOP_MAC)).isNotEmpty();
    }
}
