package com.wifi.roaming.model;

import java.time.Instant;

/**
 * Single signal strength reading.
 */
public record SignalSample(Instant timestamp, int strength) {
}
