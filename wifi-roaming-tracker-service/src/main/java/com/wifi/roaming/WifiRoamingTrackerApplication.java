package com.wifi.roaming;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main Spring Boot application class for the WiFi Roaming Tracker Service.
 *
 * <p>Consumes per-router device snapshots from an external poller, detects connects, roams and
 * disconnects, classifies why devices roam and keeps per-device mobility profiles durable in a
 * JSON file or a DynamoDB table.
 */
@Slf4j
@SpringBootApplication
@EnableScheduling
public class WifiRoamingTrackerApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(WifiRoamingTrackerApplication.class);
        try {
            app.run(args);
        } catch (Exception e) {
            log.error("Failed to start WiFi Roaming Tracker application", e);
            System.exit(1);
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        Environment env = event.getApplicationContext().getEnvironment();

        log.info("=========================================");
        log.info("WiFi Roaming Tracker Started Successfully");
        log.info("=========================================");
        log.info("Application Name: {}", env.getProperty("spring.application.name"));
        log.info("State Store: {}", env.getProperty("roaming.store.type", "file"));
        log.info("Poll Interval: {} ms", env.getProperty("roaming.polling.interval-ms", "30000"));
        log.info("Event Retention: {} days", env.getProperty("roaming.max-history-days", "30"));
        log.info("=========================================");
    }
}
