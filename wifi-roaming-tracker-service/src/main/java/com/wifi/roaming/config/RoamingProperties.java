package com.wifi.roaming.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for roaming detection and state retention.
 * Maps to the 'roaming' section in application.yml.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "roaming")
public class RoamingProperties {

    /**
     * Events older than this many days are pruned on cleanup.
     */
    @Min(value = 1, message = "Max history days must be at least 1")
    private int maxHistoryDays = 30;

    /**
     * Minimum gap between two roams of the same device before the second one is trusted.
     */
    @Min(value = 0, message = "Roaming threshold cannot be negative")
    private long roamingThresholdSeconds = 5;

    /**
     * Average session signal below which a roam is attributed to weak signal.
     */
    private int weakSignalThreshold = 30;

    /**
     * Profiles of offline devices without events for this many days are pruned.
     */
    @Min(value = 1, message = "Profile inactivity days must be at least 1")
    private int profileInactivityDays = 7;

    @Valid
    private Persistence persistence = new Persistence();

    @Valid
    private Polling polling = new Polling();

    @Valid
    private Store store = new Store();

    @Data
    public static class Persistence {
        @Min(value = 1000, message = "Save interval must be at least 1 second")
        private long saveIntervalMs = 300_000;

        @Min(value = 1000, message = "Cleanup interval must be at least 1 second")
        private long cleanupIntervalMs = 3_600_000;
    }

    @Data
    public static class Polling {
        private boolean enabled = true;

        @Min(value = 1000, message = "Polling interval must be at least 1 second")
        private long intervalMs = 30_000;
    }

    @Data
    public static class Store {
        @NotNull(message = "Store type is required")
        private StoreType type = StoreType.FILE;

        @Valid
        private File file = new File();

        @Valid
        private DynamoDb dynamodb = new DynamoDb();

        @Data
        public static class File {
            @NotBlank(message = "State file path is required")
            private String path = "data/roaming-state.json";
        }

        @Data
        public static class DynamoDb {
            @NotBlank(message = "DynamoDB table name is required")
            private String tableName = "wifi_roaming_state";

            @NotBlank(message = "DynamoDB state id is required")
            private String stateId = "default";
        }
    }

    public enum StoreType {
        FILE,
        DYNAMODB
    }
}
