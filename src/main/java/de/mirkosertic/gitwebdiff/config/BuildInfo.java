package de.mirkosertic.gitwebdiff.config;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build time of the running server, read from the Maven-filtered
 * build-info.properties. Unfiltered placeholders (IDE runs) are reported as "dev"/"unknown".
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String BUILD_INFO_FILE = "build-info.properties";

    private static final String version;
    private static final String buildTimestamp;

    static {
        final Properties props = new Properties();
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input != null) {
                props.load(input);
            } else {
                logger.debug("{} not found, running from an unpackaged build", BUILD_INFO_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load build info, using defaults", e);
        }

        version = valueOrDefault(props.getProperty("build.version"), "dev");
        buildTimestamp = valueOrDefault(props.getProperty("build.timestamp"), "unknown");
    }

    private BuildInfo() {
    }

    static String valueOrDefault(final @Nullable String value, final String fallback) {
        if (value == null || value.isBlank() || value.startsWith("${")) {
            return fallback;
        }
        return value;
    }

    public static String getVersion() {
        return version;
    }

    public static String getBuildTimestamp() {
        return buildTimestamp;
    }

    /**
     * One-line description for the startup banner.
     */
    public static String describe() {
        return "git-webdiff " + version + " (built " + buildTimestamp + ")";
    }
}
