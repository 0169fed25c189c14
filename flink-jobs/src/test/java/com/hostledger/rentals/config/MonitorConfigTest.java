package com.hostledger.rentals.config;

import org.junit.jupiter.api.Test;

import com.hostledger.rentals.notify.WebhookNotifier;
import com.hostledger.rentals.reconcile.ReconcileSettings;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MonitorConfigTest {

    @Test
    void defaultsWhenNothingIsSet() {
        MonitorConfig config = MonitorConfig.fromMap(Collections.emptyMap());

        assertEquals("kafka:9092", config.kafkaBootstrap);
        assertEquals("machine_snapshots", config.inputTopic);
        assertEquals("rental_lifecycle_events", config.eventsTopic);
        assertEquals("rental_sessions_archive", config.archiveTopic);
        assertEquals("machine_snapshots.dlq.v1", config.dlqTopic);
        assertEquals(1.0, config.diskToleranceGb, 0.0);
        assertEquals(60, config.errorPingMinutes);
        assertTrue(config.notificationTargets.isEmpty());
        assertEquals(Duration.ofSeconds(60), config.metricsRateWindow);

        ReconcileSettings settings = config.reconcileSettings();
        assertEquals(60L * 60L * 1000L, settings.alertPingIntervalMs);
        assertEquals(ReconcileSettings.DEFAULT_DISK_DROP_NOISE_GB, settings.diskDropNoiseGb, 0.0);
    }

    @Test
    void readsOverrides() {
        Map<String, String> vars = new HashMap<>();
        vars.put("MONITOR_INPUT_TOPIC", "snapshots.v2");
        vars.put("MONITOR_DISK_TOLERANCE_GB", "2.5");
        vars.put("MONITOR_ERROR_PING_MINUTES", "15");
        vars.put("MONITOR_NOTIFY_TARGETS", "[\"https://hooks.example/a\"]");
        vars.put("MONITOR_NOTIFY_MAX_ATTEMPTS", "5");
        vars.put("MONITOR_NOTIFY_INITIAL_BACKOFF_MS", "500");

        MonitorConfig config = MonitorConfig.fromMap(vars);

        assertEquals("snapshots.v2", config.inputTopic);
        assertEquals(2.5, config.reconcileSettings().diskToleranceGb, 0.0);
        assertEquals(15L * 60L * 1000L, config.reconcileSettings().alertPingIntervalMs);
        assertEquals(1, config.notificationTargets.size());
        WebhookNotifier.Settings webhook = config.webhookSettings();
        assertEquals(5, webhook.maxAttempts);
        assertEquals(500L, webhook.initialBackoffMs);
        assertEquals(10000L, webhook.maxBackoffMs);
    }

    @Test
    void unusableNumbersFallBackToDefaults() {
        Map<String, String> vars = new HashMap<>();
        vars.put("MONITOR_DISK_TOLERANCE_GB", "-3");
        vars.put("MONITOR_ERROR_PING_MINUTES", "soon");
        vars.put("MONITOR_NOTIFY_MAX_ATTEMPTS", "0");

        MonitorConfig config = MonitorConfig.fromMap(vars);

        assertEquals(ReconcileSettings.DEFAULT_DISK_TOLERANCE_GB, config.diskToleranceGb, 0.0);
        assertEquals(60, config.errorPingMinutes);
        assertEquals(1, config.notifyMaxAttempts);
    }

    @Test
    void malformedTargetsFailFast() {
        Map<String, String> vars = new HashMap<>();
        vars.put("MONITOR_NOTIFY_TARGETS", "not json");
        assertThrows(IllegalArgumentException.class, () -> MonitorConfig.fromMap(vars));
    }
}
