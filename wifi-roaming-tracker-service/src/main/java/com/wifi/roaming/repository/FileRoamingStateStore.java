package com.wifi.roaming.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wifi.roaming.config.RoamingProperties;
import com.wifi.roaming.exception.StateStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * JSON file implementation of {@link RoamingStateStore}.
 *
 * <p>Saves go to a temporary file next to the target which is then moved over it, so a crash
 * mid-write never leaves a truncated document behind.
 */
@Repository
@ConditionalOnProperty(prefix = "roaming.store", name = "type", havingValue = "file", matchIfMissing = true)
public class FileRoamingStateStore implements RoamingStateStore {

    private static final Logger logger = LoggerFactory.getLogger(FileRoamingStateStore.class);

    private final ObjectMapper objectMapper;
    private final Path statePath;

    @Autowired
    public FileRoamingStateStore(ObjectMapper objectMapper, RoamingProperties properties) {
        this(objectMapper, Path.of(properties.getStore().getFile().getPath()));
    }

    public FileRoamingStateStore(ObjectMapper objectMapper, Path statePath) {
        this.objectMapper = objectMapper;
        this.statePath = statePath.toAbsolutePath();
        logger.info("Initialized FileRoamingStateStore at {}", this.statePath);
    }

    @Override
    public Optional<RoamingStateDocument> load() {
        if (!Files.exists(statePath)) {
            logger.debug("No roaming state file at {}", statePath);
            return Optional.empty();
        }
        try (InputStream in = Files.newInputStream(statePath)) {
            return Optional.of(objectMapper.readValue(in, RoamingStateDocument.class));
        } catch (IOException | RuntimeException e) {
            throw new StateStoreException("Failed to read roaming state from " + statePath, e);
        }
    }

    @Override
    public void save(RoamingStateDocument document) {
        Path tempFile = null;
        try {
            Path directory = statePath.getParent();
            Files.createDirectories(directory);
            tempFile = Files.createTempFile(directory, statePath.getFileName().toString(), ".tmp");

            try (OutputStream out = Files.newOutputStream(tempFile)) {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(out, document);
            }
            replaceTarget(tempFile);
            tempFile = null;
            logger.debug("Wrote {} events and {} profiles to {}",
                    document.events().size(), document.deviceProfiles().size(), statePath);
        } catch (IOException e) {
            throw new StateStoreException("Failed to write roaming state to " + statePath, e);
        } finally {
            deleteQuietly(tempFile);
        }
    }

    @Override
    public String describe() {
        return "file:" + statePath;
    }

    private void replaceTarget(Path tempFile) throws IOException {
        try {
            Files.move(tempFile, statePath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, falling back to replace", statePath);
            Files.move(tempFile, statePath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path tempFile) {
        if (tempFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            logger.warn("Could not delete temporary state file {}: {}", tempFile, e.getMessage());
        }
    }
}
