package com.wifi.roaming.service;

import com.wifi.roaming.repository.RoamingStateDocument;
import com.wifi.roaming.repository.RoamingStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Best-effort persistence of the tracker state.
 *
 * <p>Store failures never reach the tracker: a missing or corrupt document loads as empty state
 * and a failed save is logged and recorded for health reporting while the in-memory state stays
 * authoritative. The next successful save flushes everything accumulated in between.
 */
@Slf4j
@Service
public class RoamingStatePersistenceService {

    private final RoamingStateStore stateStore;
    private final RoamingMetricsService metricsService;
    private final Clock clock;
    private final AtomicReference<PersistenceStatus> status;

    public RoamingStatePersistenceService(RoamingStateStore stateStore,
                                          RoamingMetricsService metricsService,
                                          Clock clock) {
        this.stateStore = stateStore;
        this.metricsService = metricsService;
        this.clock = clock;
        this.status = new AtomicReference<>(PersistenceStatus.initial(stateStore.describe()));
    }

    /**
     * Reads the persisted document.
     *
     * @return the document, or empty when the store is missing, unreadable or corrupt
     */
    public Optional<RoamingStateDocument> load() {
        try {
            Optional<RoamingStateDocument> document = stateStore.load();
            if (document.isEmpty()) {
                log.info("No persisted roaming state in {}, starting with empty state", stateStore.describe());
            } else {
                log.info("Loaded {} roaming events and {} device profiles from {}",
                        document.get().events().size(), document.get().deviceProfiles().size(),
                        stateStore.describe());
            }
            return document;
        } catch (RuntimeException e) {
            log.warn("Could not load roaming state from {}, starting with empty state: {}",
                    stateStore.describe(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Writes the document to the store.
     *
     * @return true if the store accepted the document
     */
    public boolean save(RoamingStateDocument document) {
        try {
            stateStore.save(document);
            status.updateAndGet(current -> current.succeeded(clock.instant()));
            metricsService.recordSave(true);
            log.debug("Persisted {} roaming events and {} device profiles",
                    document.events().size(), document.deviceProfiles().size());
            return true;
        } catch (RuntimeException e) {
            PersistenceStatus failed = status.updateAndGet(current -> current.failed(clock.instant(), e.getMessage()));
            metricsService.recordSave(false);
            log.error("Failed to persist roaming state to {} ({} consecutive failures): {}",
                    stateStore.describe(), failed.consecutiveFailures(), e.getMessage(), e);
            return false;
        }
    }

    public PersistenceStatus getStatus() {
        return status.get();
    }

    /**
     * Outcome of the most recent saves.
     *
     * @param store description of the backing store
     * @param lastSuccess instant of the last successful save, null if none yet
     * @param lastFailure instant of the last failed save, null if none yet
     * @param lastError message of the last failure, null if none yet
     * @param consecutiveFailures failed saves since the last success
     */
    public record PersistenceStatus(
            String store,
            Instant lastSuccess,
            Instant lastFailure,
            String lastError,
            int consecutiveFailures) {

        static PersistenceStatus initial(String store) {
            return new PersistenceStatus(store, null, null, null, 0);
        }

        PersistenceStatus succeeded(Instant at) {
            return new PersistenceStatus(store, at, lastFailure, lastError, 0);
        }

        PersistenceStatus failed(Instant at, String error) {
            return new PersistenceStatus(store, lastSuccess, at, error, consecutiveFailures + 1);
        }

        public boolean isHealthy() {
            return consecutiveFailures == 0;
        }
    }
}
