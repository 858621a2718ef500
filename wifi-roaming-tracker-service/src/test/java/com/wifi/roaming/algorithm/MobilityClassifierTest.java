package com.wifi.roaming.algorithm;

import com.wifi.roaming.dto.ConnectionMedium;
import com.wifi.roaming.dto.DeviceDescriptor;
import com.wifi.roaming.dto.MobilityPattern;
import com.wifi.roaming.dto.RoamingEvent;
import com.wifi.roaming.dto.TriggerReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("MobilityClassifier Tests")
class MobilityClassifierTest {

    private static final Instant NOW = Instant.parse("2024-05-02T08:00:00Z");
    private static final DeviceDescriptor DEVICE =
            new DeviceDescriptor("AA:BB:CC:DD:EE:01", "laptop", "192.168.178.20", 60, ConnectionMedium.WIFI);

    private MobilityClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new MobilityClassifier();
    }

    private static List<RoamingEvent> roamsEveryTenMinutesBefore(Instant end, int count) {
        List<RoamingEvent> events = new ArrayList<>();
        for (int i = count; i > 0; i--) {
            String from = i % 2 == 0 ? "router-a" : "router-b";
            String to = i % 2 == 0 ? "router-b" : "router-a";
            events.add(RoamingEvent.roam(end.minus(Duration.ofMinutes(10L * i)), DEVICE, from, to,
                    60, 600.0, TriggerReason.UNKNOWN));
        }
        return events;
    }

    @Test
    @DisplayName("should_ClassifyStatic_When_ThreeRoamsInDay")
    void should_ClassifyStatic_When_ThreeRoamsInDay() {
        double frequency = classifier.roamingFrequency(roamsEveryTenMinutesBefore(NOW, 3), NOW);

        assertThat(frequency).isCloseTo(0.125, within(1e-9));
        assertThat(classifier.classify(frequency)).isEqualTo(MobilityPattern.STATIC);
    }

    @Test
    @DisplayName("should_ClassifyMobile_When_ThirteenRoamsInDay")
    void should_ClassifyMobile_When_ThirteenRoamsInDay() {
        double frequency = classifier.roamingFrequency(roamsEveryTenMinutesBefore(NOW, 13), NOW);

        assertThat(frequency).isGreaterThan(0.5);
        assertThat(classifier.classify(frequency)).isEqualTo(MobilityPattern.MOBILE);
    }

    @Test
    @DisplayName("should_ClassifyHighlyMobile_When_FortyNineRoamsInDay")
    void should_ClassifyHighlyMobile_When_FortyNineRoamsInDay() {
        double frequency = classifier.roamingFrequency(roamsEveryTenMinutesBefore(NOW, 49), NOW);

        assertThat(frequency).isGreaterThan(2.0);
        assertThat(classifier.classify(frequency)).isEqualTo(MobilityPattern.HIGHLY_MOBILE);
    }

    @Test
    @DisplayName("should_UseStrictThresholds_When_FrequencyOnBoundary")
    void should_UseStrictThresholds_When_FrequencyOnBoundary() {
        assertThat(classifier.classify(0.5)).isEqualTo(MobilityPattern.STATIC);
        assertThat(classifier.classify(2.0)).isEqualTo(MobilityPattern.MOBILE);
    }

    @Test
    @DisplayName("should_IgnoreRoamsOutsideWindowAndNonRoamEvents")
    void should_IgnoreRoamsOutsideWindowAndNonRoamEvents() {
        List<RoamingEvent> events = new ArrayList<>();
        events.add(RoamingEvent.roam(NOW.minus(Duration.ofHours(25)), DEVICE, "router-a", "router-b",
                60, 600.0, TriggerReason.UNKNOWN));
        events.add(RoamingEvent.roam(NOW.minus(Duration.ofHours(24)), DEVICE, "router-b", "router-a",
                60, 600.0, TriggerReason.UNKNOWN));
        events.add(RoamingEvent.connect(NOW.minus(Duration.ofHours(1)), DEVICE, "router-a"));
        events.add(RoamingEvent.disconnect(NOW.minus(Duration.ofMinutes(30)), DEVICE.macAddress(),
                DEVICE.hostname(), DEVICE.ipAddress(), "router-a", 60, 1800.0));
        events.add(RoamingEvent.roam(NOW.minus(Duration.ofMinutes(5)), DEVICE, "router-a", "router-b",
                60, 600.0, TriggerReason.UNKNOWN));

        assertThat(classifier.roamingFrequency(events, NOW)).isCloseTo(1.0 / 24, within(1e-9));
    }

    @Test
    @DisplayName("should_ReturnZero_When_NoEvents")
    void should_ReturnZero_When_NoEvents() {
        assertThat(classifier.roamingFrequency(List.of(), NOW)).isZero();
        assertThat(classifier.classify(0.0)).isEqualTo(MobilityPattern.STATIC);
    }
}
