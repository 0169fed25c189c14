package com.hostledger.rentals.registry;

import com.fasterxml.jackson.core.JsonProcessingException;

import com.hostledger.rentals.model.RentalSession;
import com.hostledger.rentals.util.JsonSupport;

/**
 * JSON encoding of the persisted per-machine registry and of archived session records.
 */
public final class RegistryCodec {
    private RegistryCodec() {}

    public static String encode(RentalRegistry registry) {
        return JsonSupport.toJson(registry);
    }

    /**
     * @return the decoded registry, or {@code null} for a null/blank record
     */
    public static RentalRegistry decode(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return JsonSupport.MAPPER.readValue(json, RentalRegistry.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to decode rental registry", ex);
        }
    }

    public static String encodeArchive(RentalSession session) {
        return JsonSupport.toJson(session);
    }

    public static RentalSession decodeArchive(String json) {
        try {
            return JsonSupport.MAPPER.readValue(json, RentalSession.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to decode archived rental session", ex);
        }
    }
}
