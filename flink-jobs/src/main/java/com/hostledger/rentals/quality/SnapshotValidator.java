package com.hostledger.rentals.quality;

import com.fasterxml.jackson.databind.JsonNode;

import com.hostledger.rentals.model.RentalCategory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Structural checks on a raw machine snapshot before it is bound to {@code MachineState}.
 */
public class SnapshotValidator {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(SnapshotValidator.class);

    static final List<String> NON_NEGATIVE_COUNTERS = Collections.unmodifiableList(Arrays.asList(
            "num_gpus",
            "current_rentals_resident",
            "current_rentals_on_demand",
            "current_rentals_running",
            "current_rentals_running_on_demand"
    ));

    public ValidationResult validate(JsonNode root) {
        if (root == null || !root.isObject()) {
            LOG.debug("Snapshot validation failed: root is null or not an object");
            return ValidationResult.invalid("SCHEMA_INVALID", "root_not_object", "Root node is missing or not an object");
        }

        JsonNode machineId = root.get("machine_id");
        if (machineId == null || machineId.isNull() || !isIntegral(machineId)) {
            LOG.debug("Snapshot validation failed: missing or invalid machine_id");
            return ValidationResult.invalid("SCHEMA_INVALID", "missing_machine_id", "machine_id is missing or not an integer");
        }

        JsonNode occupancy = root.get("gpu_occupancy");
        if (occupancy == null || !occupancy.isTextual()) {
            LOG.debug("Snapshot validation failed: missing gpu_occupancy for machine {}", machineId.asText());
            return ValidationResult.invalid("SCHEMA_INVALID", "missing_occupancy", "gpu_occupancy is missing or not a string");
        }
        String trimmed = occupancy.asText().trim();
        String[] tokens = trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
        for (String token : tokens) {
            if (!RentalCategory.isKnownCode(token)) {
                LOG.debug("Snapshot validation failed: unknown occupancy token {} for machine {}", token, machineId.asText());
                return ValidationResult.invalid("SCHEMA_INVALID", "invalid_occupancy_token",
                        "Unknown occupancy token: " + token);
            }
        }

        for (String field : NON_NEGATIVE_COUNTERS) {
            JsonNode node = root.get(field);
            if (node == null || node.isNull()) {
                continue;
            }
            if (!isIntegral(node) || node.asLong() < 0) {
                LOG.debug("Snapshot validation failed: {} is negative or not an integer", field);
                return ValidationResult.invalid("SCHEMA_INVALID", "invalid_counter",
                        "Counter " + field + " must be a non-negative integer: " + node.asText());
            }
        }

        // An incomplete occupancy string would read as freed slots downstream.
        JsonNode numGpus = root.get("num_gpus");
        if (numGpus != null && !numGpus.isNull() && tokens.length < numGpus.asLong()) {
            LOG.debug("Snapshot validation failed: {} occupancy tokens for {} GPUs on machine {}",
                    tokens.length, numGpus.asText(), machineId.asText());
            return ValidationResult.invalid("SCHEMA_INVALID", "incomplete_occupancy",
                    "gpu_occupancy has " + tokens.length + " tokens but num_gpus is " + numGpus.asText());
        }

        JsonNode observedAt = root.get("observed_at");
        if (observedAt != null && !observedAt.isNull() && !isIntegral(observedAt)) {
            LOG.debug("Snapshot validation failed: observed_at is not numeric");
            return ValidationResult.invalid("SCHEMA_INVALID", "invalid_observed_at", "observed_at is not an epoch-millis integer");
        }

        return ValidationResult.valid();
    }

    // Numeric strings are accepted; some pollers serialize ids as strings.
    private static boolean isIntegral(JsonNode node) {
        if (node.isIntegralNumber()) {
            return true;
        }
        if (node.isTextual()) {
            try {
                Long.parseLong(node.asText().trim());
                return true;
            } catch (NumberFormatException ex) {
                return false;
            }
        }
        return false;
    }

    public static class ValidationResult {
        public final boolean valid;
        public final String failureClass;
        public final String reason;
        public final String details;

        private ValidationResult(boolean valid, String failureClass, String reason, String details) {
            this.valid = valid;
            this.failureClass = failureClass;
            this.reason = reason;
            this.details = details;
        }

        public static ValidationResult valid() {
            return new ValidationResult(true, null, null, null);
        }

        public static ValidationResult invalid(String failureClass, String reason, String details) {
            return new ValidationResult(false, failureClass, reason, details);
        }
    }
}
