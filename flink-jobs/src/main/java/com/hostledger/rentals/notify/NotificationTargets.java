package com.hostledger.rentals.notify;

import com.fasterxml.jackson.databind.JsonNode;

import com.hostledger.rentals.util.JsonSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parses the webhook target list from its JSON configuration.
 *
 * <p>Accepts an array whose entries are either a bare URL string or an object
 * {@code {"name":..,"url":..,"enabled":..,"events":[..]}}. Disabled entries and entries without a
 * URL are dropped. Duplicate names get a numeric suffix.</p>
 */
public final class NotificationTargets {
    private static final Logger LOG = LoggerFactory.getLogger(NotificationTargets.class);
    private static final Set<String> WILDCARDS = new HashSet<>(Arrays.asList("*", "all", "any"));

    private NotificationTargets() {}

    public static List<NotificationTarget> parse(String json) {
        if (json == null || json.trim().isEmpty()) {
            return Collections.emptyList();
        }
        JsonNode root;
        try {
            root = JsonSupport.MAPPER.readTree(json);
        } catch (Exception ex) {
            throw new IllegalArgumentException("Notification targets are not valid JSON: " + ex.getMessage(), ex);
        }
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Notification targets must be a JSON array");
        }

        List<NotificationTarget> targets = new ArrayList<>();
        Set<String> usedNames = new HashSet<>();
        int index = 0;
        for (JsonNode entry : root) {
            index++;
            NotificationTarget target = toTarget(entry, index);
            if (target == null) {
                continue;
            }
            if (!target.enabled) {
                LOG.info("Notification target {} is disabled; skipping", target.name);
                continue;
            }
            target.name = uniqueName(target.name, usedNames);
            targets.add(target);
        }
        return targets;
    }

    private static NotificationTarget toTarget(JsonNode entry, int index) {
        String defaultName = "webhook-" + index;
        if (entry.isTextual()) {
            String url = entry.asText().trim();
            if (url.isEmpty()) {
                LOG.warn("Skipping notification target #{} without URL", index);
                return null;
            }
            return new NotificationTarget(defaultName, url);
        }
        if (!entry.isObject()) {
            LOG.warn("Unsupported notification target #{}: {}", index, entry);
            return null;
        }
        String url = entry.path("url").asText("").trim();
        if (url.isEmpty()) {
            LOG.warn("Skipping notification target #{} without URL", index);
            return null;
        }
        String name = entry.path("name").asText("").trim();
        NotificationTarget target = new NotificationTarget(name.isEmpty() ? defaultName : name, url);
        target.enabled = entry.path("enabled").asBoolean(true);
        target.events = normalizeEvents(entry.get("events"), target.name);
        return target;
    }

    static Set<String> normalizeEvents(JsonNode raw, String targetName) {
        Set<String> events = new LinkedHashSet<>();
        if (raw == null || raw.isNull()) {
            return events;
        }
        List<JsonNode> values = new ArrayList<>();
        if (raw.isArray()) {
            raw.forEach(values::add);
        } else {
            values.add(raw);
        }
        for (JsonNode value : values) {
            String key = value.asText("").trim().toLowerCase(Locale.ROOT);
            if (key.isEmpty()) {
                continue;
            }
            if (WILDCARDS.contains(key)) {
                return new LinkedHashSet<>();
            }
            if (!NotificationTarget.VALID_EVENTS.contains(key)) {
                LOG.warn("Target {} specifies unknown event '{}'; skipping that entry", targetName, key);
                continue;
            }
            events.add(key);
        }
        return events;
    }

    private static String uniqueName(String base, Set<String> usedNames) {
        String name = base;
        int suffix = 1;
        while (usedNames.contains(name)) {
            suffix++;
            name = base + "-" + suffix;
        }
        usedNames.add(name);
        return name;
    }
}
