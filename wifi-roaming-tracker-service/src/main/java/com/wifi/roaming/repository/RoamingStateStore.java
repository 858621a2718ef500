package com.wifi.roaming.repository;

import com.wifi.roaming.exception.StateStoreException;

import java.util.Optional;

/**
 * Document store holding the tracker's durable state.
 * Implementations overwrite the whole document on every save.
 */
public interface RoamingStateStore {

    /**
     * Reads the stored document.
     *
     * @return the document, or empty if nothing has been stored yet
     * @throws StateStoreException if the store is unreachable or the document cannot be parsed
     */
    Optional<RoamingStateDocument> load();

    /**
     * Replaces the stored document, atomically where the backend allows it.
     *
     * @throws StateStoreException if the document cannot be written
     */
    void save(RoamingStateDocument document);

    /**
     * Human readable location of the store, used in logs and health details.
     */
    String describe();
}
