package com.wifi.roaming.algorithm;

import com.wifi.roaming.config.RoamingProperties;
import com.wifi.roaming.dto.ConnectionMedium;
import com.wifi.roaming.dto.DeviceDescriptor;
import com.wifi.roaming.dto.TriggerReason;
import com.wifi.roaming.model.DeviceSession;
import com.wifi.roaming.model.SignalTrend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("RoamingTriggerClassifier Tests")
class RoamingTriggerClassifierTest {

    private RoamingTriggerClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new RoamingTriggerClassifier(new RoamingProperties());
    }

    @Test
    @DisplayName("should_ReturnWeakSignal_When_PriorAverageBelowThreshold")
    void should_ReturnWeakSignal_When_PriorAverageBelowThreshold() {
        assertEquals(TriggerReason.WEAK_SIGNAL, classifier.classify(25.0, SignalTrend.STABLE, 70, 300.0));
    }

    @Test
    @DisplayName("should_PreferWeakSignal_When_SessionAlsoShort")
    void should_PreferWeakSignal_When_SessionAlsoShort() {
        assertEquals(TriggerReason.WEAK_SIGNAL, classifier.classify(20.0, SignalTrend.DEGRADING, 80, 10.0));
    }

    @Test
    @DisplayName("should_NotReturnWeakSignal_When_AverageEqualsThreshold")
    void should_NotReturnWeakSignal_When_AverageEqualsThreshold() {
        assertEquals(TriggerReason.UNKNOWN, classifier.classify(30.0, SignalTrend.STABLE, 35, 300.0));
    }

    @Test
    @DisplayName("should_ReturnSignalDegrading_When_TrendDegradingEvenIfNewSignalBetter")
    void should_ReturnSignalDegrading_When_TrendDegradingEvenIfNewSignalBetter() {
        assertEquals(TriggerReason.SIGNAL_DEGRADING, classifier.classify(60.0, SignalTrend.DEGRADING, 90, 10.0));
    }

    @Test
    @DisplayName("should_ReturnBetterSignal_When_NewSignalMoreThanTenAboveAverage")
    void should_ReturnBetterSignal_When_NewSignalMoreThanTenAboveAverage() {
        assertEquals(TriggerReason.BETTER_SIGNAL, classifier.classify(50.0, SignalTrend.STABLE, 61, 10.0));
    }

    @Test
    @DisplayName("should_ReturnQuickHandover_When_NewSignalExactlyTenAboveAndSessionShort")
    void should_ReturnQuickHandover_When_NewSignalExactlyTenAboveAndSessionShort() {
        assertEquals(TriggerReason.QUICK_HANDOVER, classifier.classify(50.0, SignalTrend.STABLE, 60, 59.9));
    }

    @Test
    @DisplayName("should_ReturnUnknown_When_NoRuleMatches")
    void should_ReturnUnknown_When_NoRuleMatches() {
        assertEquals(TriggerReason.UNKNOWN, classifier.classify(50.0, SignalTrend.IMPROVING, 55, 60.0));
    }

    @Test
    @DisplayName("should_HonourConfiguredWeakSignalThreshold")
    void should_HonourConfiguredWeakSignalThreshold() {
        RoamingProperties properties = new RoamingProperties();
        properties.setWeakSignalThreshold(-70);
        RoamingTriggerClassifier dbmClassifier = new RoamingTriggerClassifier(properties);

        assertEquals(TriggerReason.WEAK_SIGNAL, dbmClassifier.classify(-75.0, SignalTrend.STABLE, -60, 300.0));
        assertEquals(TriggerReason.BETTER_SIGNAL, dbmClassifier.classify(-65.0, SignalTrend.STABLE, -50, 300.0));
    }

    @Test
    @DisplayName("should_UseClosedSessionSignalHistory_When_ClassifyingSession")
    void should_UseClosedSessionSignalHistory_When_ClassifyingSession() {
        Instant start = Instant.parse("2024-05-01T08:00:00Z");
        DeviceDescriptor device = new DeviceDescriptor("AA:BB:CC:DD:EE:01", "laptop", "", 55, ConnectionMedium.WIFI);
        DeviceSession session = DeviceSession.open(device, "fritzbox-living-room", start);
        session.close(start.plusSeconds(600));

        assertEquals(TriggerReason.UNKNOWN, classifier.classify(session, 60));
        assertEquals(TriggerReason.BETTER_SIGNAL, classifier.classify(session, 66));
    }
}
