package com.wifi.roaming.service;

import com.wifi.roaming.algorithm.MobilityClassifier;
import com.wifi.roaming.algorithm.RoamingTriggerClassifier;
import com.wifi.roaming.config.RoamingProperties;
import com.wifi.roaming.dto.DeviceDescriptor;
import com.wifi.roaming.dto.DeviceProfile;
import com.wifi.roaming.dto.MobilityReport;
import com.wifi.roaming.dto.RoamingEvent;
import com.wifi.roaming.dto.RoamingEventType;
import com.wifi.roaming.dto.RouterStatistics;
import com.wifi.roaming.dto.SessionSnapshot;
import com.wifi.roaming.dto.TrackerStatistics;
import com.wifi.roaming.dto.TriggerReason;
import com.wifi.roaming.model.DeviceSession;
import com.wifi.roaming.model.ObservedDevice;
import com.wifi.roaming.repository.RoamingStateDocument;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Authoritative in-memory roaming state: open sessions, the event log and device profiles.
 *
 * <p>{@link #updateDeviceLocations(Map)} is the only mutating entry point used per poll cycle. It
 * diffs the snapshot against the open sessions and emits, in this order:
 * <ul>
 *   <li>connect and roam events, in snapshot iteration order</li>
 *   <li>disconnect events for every open session missing from the snapshot</li>
 * </ul>
 * All events of one call carry the same timestamp.
 *
 * <p>Sessions, events, profiles and statistics form a single unit guarded by one fair read/write
 * lock. Updates, cleanup and loads hold the write lock for their whole duration; queries share the
 * read lock. Persistence I/O runs outside that lock on a detached copy of the state, under a separate
 * save lock.
 */
@Slf4j
@Service
public class RoamingTracker {

    /** Window for the "recent events" section of the report and the roaming device count. */
    private static final Duration RECENT_WINDOW = Duration.ofHours(24);

    private final RoamingProperties properties;
    private final SnapshotValidationService validationService;
    private final RoamingTriggerClassifier triggerClassifier;
    private final MobilityClassifier mobilityClassifier;
    private final RoamingStatePersistenceService persistenceService;
    private final RoamingMetricsService metricsService;
    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final ReentrantLock saveLock = new ReentrantLock();
    private final Map<String, DeviceSession> activeSessions = new LinkedHashMap<>();
    private final List<RoamingEvent> events = new ArrayList<>();
    private final Map<String, DeviceProfile> profiles = new LinkedHashMap<>();
    private final Map<String, Instant> lastRoamTimes = new HashMap<>();
    private TrackerStatistics statistics = TrackerStatistics.empty();

    public RoamingTracker(RoamingProperties properties,
                          SnapshotValidationService validationService,
                          RoamingTriggerClassifier triggerClassifier,
                          MobilityClassifier mobilityClassifier,
                          RoamingStatePersistenceService persistenceService,
                          RoamingMetricsService metricsService,
                          Clock clock) {
        this.properties = properties;
        this.validationService = validationService;
        this.triggerClassifier = triggerClassifier;
        this.mobilityClassifier = mobilityClassifier;
        this.persistenceService = persistenceService;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    // === UPDATE ===

    /**
     * Applies one poll snapshot, stamped with the current clock reading.
     *
     * @param snapshot router identifier to the devices currently associated with it
     * @return events emitted by this cycle
     */
    public List<RoamingEvent> updateDeviceLocations(Map<String, List<DeviceDescriptor>> snapshot) {
        return updateDeviceLocations(snapshot, clock.instant());
    }

    /**
     * Applies one poll snapshot with an explicit cycle timestamp.
     */
    public List<RoamingEvent> updateDeviceLocations(Map<String, List<DeviceDescriptor>> snapshot, Instant now) {
        Timer.Sample sample = metricsService.startUpdate();
        Map<String, ObservedDevice> current = validationService.flatten(snapshot);
        List<RoamingEvent> emitted = new ArrayList<>();
        int active;
        int devices;

        lock.writeLock().lock();
        try {
            for (ObservedDevice observed : current.values()) {
                DeviceSession session = activeSessions.get(observed.macAddress());
                if (session == null) {
                    handleConnect(observed, now, emitted);
                } else if (session.getRouterName().equals(observed.routerName())) {
                    session.recordSignal(observed.device(), now);
                } else {
                    handleRoam(session, observed, now, emitted);
                }
            }

            Iterator<Map.Entry<String, DeviceSession>> iterator = activeSessions.entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<String, DeviceSession> entry = iterator.next();
                if (!current.containsKey(entry.getKey())) {
                    handleDisconnect(entry.getValue(), now, emitted);
                    iterator.remove();
                    refreshProfile(entry.getKey(), entry.getValue().getHostname(), null, now);
                }
            }

            recomputeStatistics(now);
            active = activeSessions.size();
            devices = profiles.size();
        } finally {
            lock.writeLock().unlock();
        }

        metricsService.recordUpdate(sample, emitted, active, devices);
        if (!emitted.isEmpty()) {
            log.debug("Poll cycle at {} produced {} events for {} observed devices", now, emitted.size(), current.size());
        }
        return emitted;
    }

    private void handleConnect(ObservedDevice observed, Instant now, List<RoamingEvent> emitted) {
        DeviceDescriptor device = observed.device();
        activeSessions.put(device.macAddress(), DeviceSession.open(device, observed.routerName(), now));
        append(RoamingEvent.connect(now, device, observed.routerName()), emitted);
        refreshProfile(device.macAddress(), device.hostname(), observed.routerName(), now);

        log.info("Device {} ({}) connected to {}", device.hostname(), device.macAddress(), observed.routerName());
    }

    private void handleRoam(DeviceSession priorSession, ObservedDevice observed, Instant now, List<RoamingEvent> emitted) {
        DeviceDescriptor device = observed.device();
        String mac = device.macAddress();

        Instant lastRoam = lastRoamTimes.get(mac);
        if (lastRoam != null
                && Duration.between(lastRoam, now).toMillis() < properties.getRoamingThresholdSeconds() * 1000) {
            log.debug("Deferring roam of {} from {} to {}: previous roam at {} is within {}s",
                    mac, priorSession.getRouterName(), observed.routerName(), lastRoam,
                    properties.getRoamingThresholdSeconds());
            return;
        }

        priorSession.close(now);
        TriggerReason reason = triggerClassifier.classify(priorSession, device.signalStrength());
        double priorDuration = priorSession.getDurationSeconds() == null ? 0.0 : priorSession.getDurationSeconds();

        append(RoamingEvent.roam(now, device, priorSession.getRouterName(), observed.routerName(),
                priorSession.currentSignal(), priorDuration, reason), emitted);
        activeSessions.put(mac, DeviceSession.open(device, observed.routerName(), now));
        lastRoamTimes.put(mac, now);
        refreshProfile(mac, device.hostname(), observed.routerName(), now);

        log.info("Device {} ({}) roamed from {} to {} after {}s, trigger: {}",
                device.hostname(), mac, priorSession.getRouterName(), observed.routerName(),
                String.format("%.1f", priorDuration), reason.getCode());
    }

    private void handleDisconnect(DeviceSession session, Instant now, List<RoamingEvent> emitted) {
        session.close(now);
        double duration = session.getDurationSeconds() == null ? 0.0 : session.getDurationSeconds();
        append(RoamingEvent.disconnect(now, session.getMacAddress(), session.getHostname(), session.getIpAddress(),
                session.getRouterName(), session.currentSignal(), duration), emitted);

        log.info("Device {} ({}) disconnected from {} after {}s",
                session.getHostname(), session.getMacAddress(), session.getRouterName(),
                String.format("%.1f", duration));
    }

    private void append(RoamingEvent event, List<RoamingEvent> emitted) {
        events.add(event);
        emitted.add(event);
    }

    /**
     * Creates the profile on first sight and refreshes everything derived from the event log.
     *
     * @param router router the device is now on, null after a disconnect
     */
    private void refreshProfile(String mac, String hostname, String router, Instant now) {
        DeviceProfile profile = profiles.computeIfAbsent(mac, key -> DeviceProfile.firstSeen(key, hostname, now));
        if (hostname != null && !hostname.isEmpty()) {
            profile.setHostname(hostname);
        }
        if (router != null) {
            profile.getRouters().add(router);
            profile.setCurrentRouter(router);
        } else {
            profile.setCurrentRouter("");
        }
        profile.setLastSeen(now);
        recomputeDerivedFields(profile, now);
    }

    private void recomputeDerivedFields(DeviceProfile profile, Instant now) {
        List<RoamingEvent> deviceEvents = events.stream()
                .filter(event -> event.involves(profile.getMacAddress()))
                .toList();

        double frequency = mobilityClassifier.roamingFrequency(deviceEvents, now);
        profile.setRoamingFrequency(frequency);
        profile.setMobilityPattern(mobilityClassifier.classify(frequency));
        profile.setTotalRoams((int) deviceEvents.stream().filter(RoamingEvent::isRoam).count());
        profile.setAverageSessionDuration(deviceEvents.stream()
                .map(RoamingEvent::sessionDuration)
                .filter(duration -> duration != null)
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0));
    }

    private void recomputeStatistics(Instant now) {
        Instant recentCutoff = now.minus(RECENT_WINDOW);
        int totalRoams = (int) events.stream().filter(RoamingEvent::isRoam).count();
        int roamingDevices = (int) events.stream()
                .filter(RoamingEvent::isRoam)
                .filter(event -> event.timestamp().isAfter(recentCutoff))
                .map(RoamingEvent::macAddress)
                .distinct()
                .count();
        statistics = new TrackerStatistics(totalRoams, events.size(), profiles.size(),
                activeSessions.size(), roamingDevices, now);
    }

    // === RETENTION ===

    /**
     * Prunes old events and stale profiles using the current clock reading, then persists.
     */
    public CleanupResult cleanupOldData() {
        return cleanupOldData(clock.instant());
    }

    /**
     * Drops events older than the retention horizon and profiles of devices that are offline and
     * have no events within the profile inactivity window, then saves immediately.
     */
    public CleanupResult cleanupOldData(Instant now) {
        Instant eventCutoff = now.minus(Duration.ofDays(properties.getMaxHistoryDays()));
        Instant profileCutoff = now.minus(Duration.ofDays(properties.getProfileInactivityDays()));
        CleanupResult result;

        lock.writeLock().lock();
        try {
            int eventsBefore = events.size();
            events.removeIf(event -> event.timestamp().isBefore(eventCutoff));

            Set<String> recentlySeen = events.stream()
                    .filter(event -> !event.timestamp().isBefore(profileCutoff))
                    .map(RoamingEvent::macAddress)
                    .collect(Collectors.toSet());
            int profilesBefore = profiles.size();
            profiles.keySet().removeIf(mac -> !activeSessions.containsKey(mac) && !recentlySeen.contains(mac));
            lastRoamTimes.keySet().retainAll(profiles.keySet());

            profiles.values().forEach(profile -> recomputeDerivedFields(profile, now));
            recomputeStatistics(now);
            metricsService.recordState(activeSessions.size(), profiles.size());

            result = new CleanupResult(eventsBefore - events.size(), profilesBefore - profiles.size());
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Roaming cleanup removed {} events older than {} and {} inactive profiles",
                result.eventsRemoved(), eventCutoff, result.profilesRemoved());
        saveState();
        return result;
    }

    // === PERSISTENCE LIFECYCLE ===

    /**
     * Replaces the in-memory events and profiles with the persisted ones. Open sessions are kept.
     *
     * <p>Events emitted after the newest persisted event are carried over, and every open session
     * whose device has no persisted profile gets one rebuilt from the session.
     */
    public void loadState() {
        Optional<RoamingStateDocument> loaded = persistenceService.load();
        if (loaded.isEmpty()) {
            return;
        }
        RoamingStateDocument document = loaded.get();
        Instant now = clock.instant();

        lock.writeLock().lock();
        try {
            Instant newestStored = document.events().stream()
                    .map(RoamingEvent::timestamp)
                    .max(Comparator.naturalOrder())
                    .orElse(null);
            List<RoamingEvent> unsaved = events.stream()
                    .filter(event -> newestStored == null || event.timestamp().isAfter(newestStored))
                    .toList();

            events.clear();
            events.addAll(document.events());
            events.addAll(unsaved);

            profiles.clear();
            for (DeviceProfile stored : document.deviceProfiles()) {
                if (stored == null || stored.getMacAddress() == null) {
                    log.warn("Skipping persisted device profile without MAC address");
                    continue;
                }
                DeviceProfile profile = stored.copy();
                DeviceSession session = activeSessions.get(profile.getMacAddress());
                profile.setCurrentRouter(session == null ? "" : session.getRouterName());
                profiles.put(profile.getMacAddress(), profile);
            }
            for (DeviceSession session : activeSessions.values()) {
                if (!profiles.containsKey(session.getMacAddress())) {
                    DeviceProfile profile = DeviceProfile.firstSeen(
                            session.getMacAddress(), session.getHostname(), session.getStartTime());
                    profiles.put(session.getMacAddress(), profile);
                    refreshProfile(session.getMacAddress(), session.getHostname(), session.getRouterName(), now);
                }
            }
            if (!unsaved.isEmpty()) {
                log.info("Kept {} roaming events newer than the persisted state", unsaved.size());
            }

            lastRoamTimes.clear();
            for (RoamingEvent event : events) {
                if (event.isRoam()) {
                    lastRoamTimes.merge(event.macAddress(), event.timestamp(),
                            (existing, candidate) -> candidate.isAfter(existing) ? candidate : existing);
                }
            }

            recomputeStatistics(now);
            metricsService.recordState(activeSessions.size(), profiles.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Writes events, profiles and statistics to the state store. Saves run one at a time, so the
     * document written last is always the newest snapshot.
     *
     * @return true if the store accepted the document
     */
    public boolean saveState() {
        saveLock.lock();
        try {
            RoamingStateDocument document;
            lock.readLock().lock();
            try {
                document = new RoamingStateDocument(
                        List.copyOf(events),
                        profiles.values().stream().map(DeviceProfile::copy).toList(),
                        statistics,
                        clock.instant());
            } finally {
                lock.readLock().unlock();
            }
            return persistenceService.save(document);
        } finally {
            saveLock.unlock();
        }
    }

    // === QUERIES ===

    public List<RoamingEvent> getRoamingEvents(int hours) {
        return getRoamingEvents(hours, null);
    }

    /**
     * Events newer than {@code hours} ago, optionally restricted to one device.
     *
     * @param deviceMac MAC address to filter on, null for all devices
     */
    public List<RoamingEvent> getRoamingEvents(int hours, String deviceMac) {
        Instant cutoff = clock.instant().minus(Duration.ofHours(hours));
        String mac = validationService.normalizeMac(deviceMac);

        lock.readLock().lock();
        try {
            return eventsSince(cutoff, mac);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<DeviceProfile> getDeviceProfile(String macAddress) {
        String mac = validationService.normalizeMac(macAddress);
        lock.readLock().lock();
        try {
            return Optional.ofNullable(profiles.get(mac)).map(DeviceProfile::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<DeviceProfile> getDeviceProfiles() {
        lock.readLock().lock();
        try {
            return profiles.values().stream().map(DeviceProfile::copy).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<SessionSnapshot> getActiveSessions() {
        lock.readLock().lock();
        try {
            return sessionSnapshots();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Router the device currently has an open session on.
     */
    public Optional<String> getDeviceCurrentRouter(String macAddress) {
        String mac = validationService.normalizeMac(macAddress);
        lock.readLock().lock();
        try {
            return Optional.ofNullable(activeSessions.get(mac)).map(DeviceSession::getRouterName);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<RouterStatistics> getRouterStatistics() {
        lock.readLock().lock();
        try {
            return routerStatistics();
        } finally {
            lock.readLock().unlock();
        }
    }

    public TrackerStatistics getStatistics() {
        lock.readLock().lock();
        try {
            return statistics;
        } finally {
            lock.readLock().unlock();
        }
    }

    public MobilityReport getMobilityReport() {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            return new MobilityReport(
                    now,
                    statistics,
                    sessionSnapshots(),
                    eventsSince(now.minus(RECENT_WINDOW), null),
                    profiles.values().stream().map(DeviceProfile::copy).toList(),
                    routerStatistics());
        } finally {
            lock.readLock().unlock();
        }
    }

    // Callers hold the read or write lock.

    private List<RoamingEvent> eventsSince(Instant cutoff, String mac) {
        return events.stream()
                .filter(event -> event.timestamp().isAfter(cutoff))
                .filter(event -> mac == null || event.involves(mac))
                .toList();
    }

    private List<SessionSnapshot> sessionSnapshots() {
        return activeSessions.values().stream().map(DeviceSession::toSnapshot).toList();
    }

    private List<RouterStatistics> routerStatistics() {
        Map<String, RouterCounters> counters = new TreeMap<>();
        for (RoamingEvent event : events) {
            if (event.eventType() == RoamingEventType.CONNECT) {
                counters.computeIfAbsent(event.toRouter(), RouterCounters::new).totalConnections++;
            } else if (event.eventType() == RoamingEventType.ROAM) {
                RouterCounters target = counters.computeIfAbsent(event.toRouter(), RouterCounters::new);
                target.totalConnections++;
                target.roamsIn++;
                counters.computeIfAbsent(event.fromRouter(), RouterCounters::new).roamsOut++;
            } else {
                counters.computeIfAbsent(event.fromRouter(), RouterCounters::new);
            }
        }
        for (DeviceSession session : activeSessions.values()) {
            counters.computeIfAbsent(session.getRouterName(), RouterCounters::new).activeConnections++;
        }
        return counters.values().stream().map(RouterCounters::toStatistics).toList();
    }

    /**
     * Number of events and profiles removed by a cleanup run.
     */
    public record CleanupResult(int eventsRemoved, int profilesRemoved) {
    }

    private static final class RouterCounters {
        private final String routerName;
        private int totalConnections;
        private int activeConnections;
        private int roamsIn;
        private int roamsOut;

        private RouterCounters(String routerName) {
            this.routerName = routerName;
        }

        private RouterStatistics toStatistics() {
            return new RouterStatistics(routerName, totalConnections, activeConnections, roamsIn, roamsOut);
        }
    }
}
