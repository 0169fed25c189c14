package com.hostledger.rentals.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.util.Properties;

/**
 * Version and commit of the rental monitor build.
 *
 * <p>Read from {@code build-info.properties}, which Maven filters with {@code build.version} from
 * {@code project.version} and {@code build.git.commit} from the {@code git.commit} property
 * ({@code -Dgit.commit=...} at release time). The resulting {@link #identity()} is logged when the
 * job and the reconcile operator start and is stamped on every rejected snapshot so DLQ records
 * can be traced back to the monitor build that produced them. A missing or unfiltered resource
 * yields {@code dev+unknown}.</p>
 */
public final class BuildMetadata implements Serializable {
    private static final long serialVersionUID = 1L;
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(BuildMetadata.class);

    static final String BUILD_INFO_RESOURCE = "build-info.properties";
    private static final BuildMetadata INSTANCE = load(BUILD_INFO_RESOURCE);

    private final String version;
    private final String gitCommit;

    BuildMetadata(String version, String gitCommit) {
        this.version = normalize(version, "dev");
        this.gitCommit = normalize(gitCommit, "unknown");
    }

    public static BuildMetadata current() {
        return INSTANCE;
    }

    public String version() {
        return version;
    }

    public String gitCommit() {
        return gitCommit;
    }

    public String identity() {
        return version + "+" + gitCommit;
    }

    static BuildMetadata load(String resource) {
        Properties props = new Properties();
        try (InputStream in = BuildMetadata.class.getClassLoader().getResourceAsStream(resource)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException ex) {
            LOG.warn("Could not read {}: {}", resource, ex.getMessage());
        }
        return new BuildMetadata(props.getProperty("build.version"), props.getProperty("build.git.commit"));
    }

    // Unfiltered Maven placeholders count as missing.
    static String normalize(String value, String fallback) {
        if (value == null) {
            return fallback;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty() || (trimmed.startsWith("${") && trimmed.endsWith("}"))) {
            return fallback;
        }
        return trimmed;
    }
}
