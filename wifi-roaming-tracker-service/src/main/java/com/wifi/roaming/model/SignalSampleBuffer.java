package com.wifi.roaming.model;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, insertion-ordered history of signal readings for one session.
 *
 * <p>Holds at most {@value #CAPACITY} samples; recording beyond that evicts the oldest. The trend
 * compares the earlier and later halves of the last {@value #TREND_WINDOW} samples and only calls
 * a change once the half means differ by at least {@value #TREND_THRESHOLD} units.
 *
 * <p>Not thread-safe. Sessions are only touched under the tracker's lock.
 */
public class SignalSampleBuffer {

    public static final int CAPACITY = 100;
    static final int TREND_WINDOW = 10;
    static final double TREND_THRESHOLD = 5.0;

    private final Deque<SignalSample> samples = new ArrayDeque<>();

    public void record(Instant timestamp, int strength) {
        samples.addLast(new SignalSample(timestamp, strength));
        while (samples.size() > CAPACITY) {
            samples.removeFirst();
        }
    }

    public double average() {
        if (samples.isEmpty()) {
            return 0.0;
        }
        long sum = 0;
        for (SignalSample sample : samples) {
            sum += sample.strength();
        }
        return (double) sum / samples.size();
    }

    public SignalTrend trend() {
        if (samples.size() < 2) {
            return SignalTrend.STABLE;
        }
        List<SignalSample> recent = recentSamples(TREND_WINDOW);
        int half = recent.size() / 2;
        double earlier = mean(recent.subList(0, half));
        double later = mean(recent.subList(half, recent.size()));
        double delta = later - earlier;

        if (delta >= TREND_THRESHOLD) {
            return SignalTrend.IMPROVING;
        }
        if (delta <= -TREND_THRESHOLD) {
            return SignalTrend.DEGRADING;
        }
        return SignalTrend.STABLE;
    }

    /**
     * Most recent reading, or 0 when nothing was recorded yet.
     */
    public int latest() {
        SignalSample last = samples.peekLast();
        return last == null ? 0 : last.strength();
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public List<SignalSample> getSamples() {
        return List.copyOf(samples);
    }

    private List<SignalSample> recentSamples(int count) {
        List<SignalSample> all = new ArrayList<>(samples);
        return all.subList(Math.max(0, all.size() - count), all.size());
    }

    private static double mean(List<SignalSample> window) {
        return window.stream().mapToInt(SignalSample::strength).average().orElse(0.0);
    }
}
