package com.wifi.roaming.service;

import com.wifi.roaming.dto.RoamingEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the roaming tracker.
 *
 * <p>Counts emitted events by type, rejected descriptors and persistence outcomes, times each
 * update cycle and exposes the current session and device counts as gauges.
 */
@Service
public class RoamingMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter connectEventsCounter;
    private final Counter roamEventsCounter;
    private final Counter disconnectEventsCounter;
    private final Counter rejectedDescriptorsCounter;
    private final Counter savesSucceededCounter;
    private final Counter savesFailedCounter;
    private final Timer updateTimer;

    private final AtomicInteger activeSessions = new AtomicInteger();
    private final AtomicInteger trackedDevices = new AtomicInteger();

    public RoamingMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.connectEventsCounter = eventCounter("connect");
        this.roamEventsCounter = eventCounter("roam");
        this.disconnectEventsCounter = eventCounter("disconnect");

        this.rejectedDescriptorsCounter = Counter.builder("roaming.descriptors.rejected.total")
            .description("Snapshot entries skipped because they were malformed")
            .register(meterRegistry);

        this.savesSucceededCounter = Counter.builder("roaming.persistence.saves.total")
            .description("Roaming state saves")
            .tag("result", "success")
            .register(meterRegistry);
        this.savesFailedCounter = Counter.builder("roaming.persistence.saves.total")
            .description("Roaming state saves")
            .tag("result", "failure")
            .register(meterRegistry);

        this.updateTimer = Timer.builder("roaming.update.duration")
            .description("Time taken to apply one poll snapshot")
            .register(meterRegistry);

        Gauge.builder("roaming.sessions.active", activeSessions, AtomicInteger::get)
            .description("Devices with an open session")
            .register(meterRegistry);
        Gauge.builder("roaming.devices.tracked", trackedDevices, AtomicInteger::get)
            .description("Devices with a mobility profile")
            .register(meterRegistry);
    }

    public Timer.Sample startUpdate() {
        return Timer.start(meterRegistry);
    }

    public void recordUpdate(Timer.Sample sample, Collection<RoamingEvent> emitted, int active, int devices) {
        sample.stop(updateTimer);
        for (RoamingEvent event : emitted) {
            switch (event.eventType()) {
                case CONNECT -> connectEventsCounter.increment();
                case ROAM -> roamEventsCounter.increment();
                case DISCONNECT -> disconnectEventsCounter.increment();
            }
        }
        recordState(active, devices);
    }

    public void recordState(int active, int devices) {
        activeSessions.set(active);
        trackedDevices.set(devices);
    }

    public void recordRejectedDescriptor() {
        rejectedDescriptorsCounter.increment();
    }

    public void recordSave(boolean success) {
        if (success) {
            savesSucceededCounter.increment();
        } else {
            savesFailedCounter.increment();
        }
    }

    private Counter eventCounter(String type) {
        return Counter.builder("roaming.events.total")
            .description("Roaming events emitted")
            .tag("type", type)
            .register(meterRegistry);
    }
}
