package com.hostledger.rentals.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BuildMetadataTest {

    @Test
    void unfilteredPlaceholdersFallBack() {
        assertEquals("dev", BuildMetadata.normalize("${project.version}", "dev"));
        assertEquals("unknown", BuildMetadata.normalize("  ", "unknown"));
        assertEquals("unknown", BuildMetadata.normalize(null, "unknown"));
        assertEquals("1.2.0", BuildMetadata.normalize(" 1.2.0 ", "dev"));
    }

    @Test
    void missingResourceYieldsFallbackIdentity() {
        BuildMetadata metadata = BuildMetadata.load("no-such-build-info.properties");
        assertEquals("dev+unknown", metadata.identity());
    }

    @Test
    void currentIsAlwaysAvailable() {
        assertNotNull(BuildMetadata.current().version());
        assertFalse(BuildMetadata.current().gitCommit().isEmpty());
    }
}
