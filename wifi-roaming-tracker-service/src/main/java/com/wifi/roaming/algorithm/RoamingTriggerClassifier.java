package com.wifi.roaming.algorithm;

import com.wifi.roaming.config.RoamingProperties;
import com.wifi.roaming.dto.TriggerReason;
import com.wifi.roaming.model.DeviceSession;
import com.wifi.roaming.model.SignalTrend;
import org.springframework.stereotype.Component;

/**
 * Explains why a device left its previous router.
 *
 * <p>The rules are evaluated in a fixed order and the first match wins:
 * <ol>
 *   <li>average signal of the prior session below the weak-signal threshold: {@code weak_signal}</li>
 *   <li>prior session trend degrading: {@code signal_degrading}</li>
 *   <li>new reading more than {@value #BETTER_SIGNAL_MARGIN} units above the prior average: {@code better_signal}</li>
 *   <li>prior session shorter than {@value #QUICK_HANDOVER_SECONDS} seconds: {@code quick_handover}</li>
 *   <li>otherwise {@code unknown}</li>
 * </ol>
 */
@Component
public class RoamingTriggerClassifier {

    static final int BETTER_SIGNAL_MARGIN = 10;
    static final double QUICK_HANDOVER_SECONDS = 60.0;

    private final RoamingProperties properties;

    public RoamingTriggerClassifier(RoamingProperties properties) {
        this.properties = properties;
    }

    /**
     * Classifies a roam away from a closed session.
     *
     * @param priorSession the session the device just left, already closed
     * @param newSignal first signal reading on the new router
     */
    public TriggerReason classify(DeviceSession priorSession, int newSignal) {
        double duration = priorSession.getDurationSeconds() == null ? 0.0 : priorSession.getDurationSeconds();
        return classify(priorSession.averageSignal(), priorSession.signalTrend(), newSignal, duration);
    }

    public TriggerReason classify(double priorAverage, SignalTrend priorTrend, int newSignal, double priorDurationSeconds) {
        if (priorAverage < properties.getWeakSignalThreshold()) {
            return TriggerReason.WEAK_SIGNAL;
        }
        if (priorTrend == SignalTrend.DEGRADING) {
            return TriggerReason.SIGNAL_DEGRADING;
        }
        if (newSignal > priorAverage + BETTER_SIGNAL_MARGIN) {
            return TriggerReason.BETTER_SIGNAL;
        }
        if (priorDurationSeconds < QUICK_HANDOVER_SECONDS) {
            return TriggerReason.QUICK_HANDOVER;
        }
        return TriggerReason.UNKNOWN;
    }
}
