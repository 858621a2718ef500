package com.wifi.roaming.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("SignalSampleBuffer Tests")
class SignalSampleBufferTest {

    private static final Instant START = Instant.parse("2024-05-01T08:00:00Z");

    private SignalSampleBuffer buffer;

    @BeforeEach
    void setUp() {
        buffer = new SignalSampleBuffer();
    }

    private void recordAll(int... strengths) {
        for (int i = 0; i < strengths.length; i++) {
            buffer.record(START.plusSeconds(30L * i), strengths[i]);
        }
    }

    @Test
    @DisplayName("should_ReturnZeroAndStable_When_Empty")
    void should_ReturnZeroAndStable_When_Empty() {
        assertThat(buffer.isEmpty()).isTrue();
        assertThat(buffer.average()).isZero();
        assertThat(buffer.latest()).isZero();
        assertThat(buffer.trend()).isEqualTo(SignalTrend.STABLE);
    }

    @Test
    @DisplayName("should_BeStable_When_SingleSample")
    void should_BeStable_When_SingleSample() {
        recordAll(80);

        assertThat(buffer.trend()).isEqualTo(SignalTrend.STABLE);
        assertThat(buffer.average()).isEqualTo(80.0);
    }

    @Test
    @DisplayName("should_EvictOldestSample_When_CapacityExceeded")
    void should_EvictOldestSample_When_CapacityExceeded() {
        for (int i = 0; i <= SignalSampleBuffer.CAPACITY; i++) {
            buffer.record(START.plusSeconds(i), i);
        }

        List<SignalSample> samples = buffer.getSamples();
        assertThat(samples).hasSize(SignalSampleBuffer.CAPACITY);
        assertThat(samples.get(0).strength()).isEqualTo(1);
        assertThat(buffer.latest()).isEqualTo(SignalSampleBuffer.CAPACITY);
    }

    @Test
    @DisplayName("should_AverageAllRetainedSamples")
    void should_AverageAllRetainedSamples() {
        recordAll(40, 50, 60, 71);

        assertThat(buffer.average()).isCloseTo(55.25, within(1e-9));
    }

    @Test
    @DisplayName("should_ReportImproving_When_LaterHalfAtLeastFiveHigher")
    void should_ReportImproving_When_LaterHalfAtLeastFiveHigher() {
        recordAll(40, 40, 45, 45);

        assertThat(buffer.trend()).isEqualTo(SignalTrend.IMPROVING);
    }

    @Test
    @DisplayName("should_ReportDegrading_When_LaterHalfAtLeastFiveLower")
    void should_ReportDegrading_When_LaterHalfAtLeastFiveLower() {
        recordAll(70, 70, 70, 70, 70, 50, 50, 50, 50, 50);

        assertThat(buffer.trend()).isEqualTo(SignalTrend.DEGRADING);
    }

    @Test
    @DisplayName("should_ReportStable_When_ChangeBelowThreshold")
    void should_ReportStable_When_ChangeBelowThreshold() {
        recordAll(60, 62, 63, 64);

        assertThat(buffer.trend()).isEqualTo(SignalTrend.STABLE);
    }

    @Test
    @DisplayName("should_PutMiddleSampleInLaterHalf_When_OddSampleCount")
    void should_PutMiddleSampleInLaterHalf_When_OddSampleCount() {
        // earlier = [50], later = [40, 40]
        recordAll(50, 40, 40);

        assertThat(buffer.trend()).isEqualTo(SignalTrend.DEGRADING);
    }

    @Test
    @DisplayName("should_OnlyConsiderLastTenSamples_When_ComputingTrend")
    void should_OnlyConsiderLastTenSamples_When_ComputingTrend() {
        // an old drop from 90 must not count once it falls out of the trend window
        recordAll(90, 90, 90, 90, 90, 60, 60, 60, 60, 60, 60, 60, 60, 60, 60);

        assertThat(buffer.trend()).isEqualTo(SignalTrend.STABLE);
    }
}
