package com.hostledger.rentals.config;

import com.hostledger.rentals.notify.NotificationTarget;
import com.hostledger.rentals.notify.NotificationTargets;
import com.hostledger.rentals.notify.WebhookNotifier;
import com.hostledger.rentals.reconcile.ReconcileSettings;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration for the rental monitor job, sourced from environment variables.
 */
public class MonitorConfig implements java.io.Serializable {
    private static final long serialVersionUID = 1L;

    public final String kafkaBootstrap;
    public final String inputTopic;
    public final String eventsTopic;
    public final String archiveTopic;
    public final String dlqTopic;
    public final String kafkaGroupId;

    public final double diskToleranceGb;
    public final int errorPingMinutes;
    public final long checkpointIntervalMs;

    public final List<NotificationTarget> notificationTargets;
    public final int notifyMaxAttempts;
    public final long notifyInitialBackoffMs;
    public final long notifyMaxBackoffMs;
    public final long notifyHttpTimeoutMs;

    public final Duration metricsRateWindow;

    private MonitorConfig(
            String kafkaBootstrap,
            String inputTopic,
            String eventsTopic,
            String archiveTopic,
            String dlqTopic,
            String kafkaGroupId,
            double diskToleranceGb,
            int errorPingMinutes,
            long checkpointIntervalMs,
            List<NotificationTarget> notificationTargets,
            int notifyMaxAttempts,
            long notifyInitialBackoffMs,
            long notifyMaxBackoffMs,
            long notifyHttpTimeoutMs,
            Duration metricsRateWindow) {
        this.kafkaBootstrap = kafkaBootstrap;
        this.inputTopic = inputTopic;
        this.eventsTopic = eventsTopic;
        this.archiveTopic = archiveTopic;
        this.dlqTopic = dlqTopic;
        this.kafkaGroupId = kafkaGroupId;
        this.diskToleranceGb = diskToleranceGb;
        this.errorPingMinutes = errorPingMinutes;
        this.checkpointIntervalMs = checkpointIntervalMs;
        this.notificationTargets = Collections.unmodifiableList(new ArrayList<>(notificationTargets));
        this.notifyMaxAttempts = notifyMaxAttempts;
        this.notifyInitialBackoffMs = notifyInitialBackoffMs;
        this.notifyMaxBackoffMs = notifyMaxBackoffMs;
        this.notifyHttpTimeoutMs = notifyHttpTimeoutMs;
        this.metricsRateWindow = metricsRateWindow;
    }

    public static MonitorConfig fromEnv() {
        return fromMap(System.getenv());
    }

    /**
     * Same as {@link #fromEnv()} but reads from the given variables; blank or unparseable values
     * fall back to the defaults. An invalid {@code MONITOR_NOTIFY_TARGETS} fails fast.
     */
    public static MonitorConfig fromMap(Map<String, String> vars) {
        String kafkaBootstrap = env(vars, "MONITOR_KAFKA_BOOTSTRAP", "kafka:9092");
        String inputTopic = env(vars, "MONITOR_INPUT_TOPIC", "machine_snapshots");
        String eventsTopic = env(vars, "MONITOR_EVENTS_TOPIC", "rental_lifecycle_events");
        String archiveTopic = env(vars, "MONITOR_ARCHIVE_TOPIC", "rental_sessions_archive");
        String dlqTopic = env(vars, "MONITOR_DLQ_TOPIC", "machine_snapshots.dlq.v1");
        String kafkaGroupId = env(vars, "MONITOR_GROUP_ID", "rental-ledger-monitor-v1");

        double diskToleranceGb = envDouble(vars, "MONITOR_DISK_TOLERANCE_GB", ReconcileSettings.DEFAULT_DISK_TOLERANCE_GB);
        if (diskToleranceGb <= 0.0) {
            diskToleranceGb = ReconcileSettings.DEFAULT_DISK_TOLERANCE_GB;
        }
        int errorPingMinutes = Math.max(0, envInt(vars, "MONITOR_ERROR_PING_MINUTES", 60));
        long checkpointIntervalMs = envLong(vars, "MONITOR_CHECKPOINT_INTERVAL_MS", 60000L);

        List<NotificationTarget> notificationTargets = NotificationTargets.parse(env(vars, "MONITOR_NOTIFY_TARGETS", "[]"));
        int notifyMaxAttempts = Math.max(1, envInt(vars, "MONITOR_NOTIFY_MAX_ATTEMPTS", 3));
        long notifyInitialBackoffMs = envLong(vars, "MONITOR_NOTIFY_INITIAL_BACKOFF_MS", 2000L);
        long notifyMaxBackoffMs = envLong(vars, "MONITOR_NOTIFY_MAX_BACKOFF_MS", 10000L);
        long notifyHttpTimeoutMs = envLong(vars, "MONITOR_NOTIFY_HTTP_TIMEOUT_MS", 10000L);

        Duration metricsRateWindow = Duration.ofSeconds(envInt(vars, "MONITOR_METRICS_RATE_WINDOW_SEC", 60));

        return new MonitorConfig(
                kafkaBootstrap,
                inputTopic,
                eventsTopic,
                archiveTopic,
                dlqTopic,
                kafkaGroupId,
                diskToleranceGb,
                errorPingMinutes,
                checkpointIntervalMs,
                notificationTargets,
                notifyMaxAttempts,
                notifyInitialBackoffMs,
                notifyMaxBackoffMs,
                notifyHttpTimeoutMs,
                metricsRateWindow);
    }

    public ReconcileSettings reconcileSettings() {
        return new ReconcileSettings(
                diskToleranceGb,
                ReconcileSettings.DEFAULT_DISK_DROP_NOISE_GB,
                Duration.ofMinutes(errorPingMinutes).toMillis());
    }

    public WebhookNotifier.Settings webhookSettings() {
        return new WebhookNotifier.Settings(
                notifyMaxAttempts,
                notifyInitialBackoffMs,
                notifyMaxBackoffMs,
                notifyHttpTimeoutMs);
    }

    private static String env(Map<String, String> vars, String key, String defaultValue) {
        String value = vars.get(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    private static int envInt(Map<String, String> vars, String key, int defaultValue) {
        String value = vars.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }

    private static long envLong(Map<String, String> vars, String key, long defaultValue) {
        String value = vars.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }

    private static double envDouble(Map<String, String> vars, String key, double defaultValue) {
        String value = vars.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }
}
