package com.wifi.roaming.algorithm;

import com.wifi.roaming.dto.MobilityPattern;
import com.wifi.roaming.dto.RoamingEvent;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;

/**
 * Derives roaming frequency and mobility pattern from a device's event history.
 *
 * <p>Frequency is the number of roam events in the trailing 24 hours divided by 24. Connects and
 * disconnects never count, so a device's first appearance does not make it mobile.
 */
@Component
public class MobilityClassifier {

    public static final Duration FREQUENCY_WINDOW = Duration.ofHours(24);
    static final double HIGHLY_MOBILE_ROAMS_PER_HOUR = 2.0;
    static final double MOBILE_ROAMS_PER_HOUR = 0.5;

    /**
     * Roams per hour for the device over the window ending at {@code now}.
     *
     * @param deviceEvents events of a single device
     */
    public double roamingFrequency(Collection<RoamingEvent> deviceEvents, Instant now) {
        Instant cutoff = now.minus(FREQUENCY_WINDOW);
        long roams = deviceEvents.stream()
                .filter(RoamingEvent::isRoam)
                .filter(event -> event.timestamp().isAfter(cutoff))
                .count();
        return roams / (double) FREQUENCY_WINDOW.toHours();
    }

    public MobilityPattern classify(double roamsPerHour) {
        if (roamsPerHour > HIGHLY_MOBILE_ROAMS_PER_HOUR) {
            return MobilityPattern.HIGHLY_MOBILE;
        }
        if (roamsPerHour > MOBILE_ROAMS_PER_HOUR) {
            return MobilityPattern.MOBILE;
        }
        return MobilityPattern.STATIC;
    }
}
