package io.github.trustedsql.common.util;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Controls how allowlist rejections are reported.
 *
 * <p>Defaults come from {@code reference.conf} under {@value #CONFIG_PATH} and can be overridden
 * in {@code application.conf} or with system properties, e.g.
 * {@code -Dtrusted-sql.diagnostics.max-listed-items=5}.
 */
public record DiagnosticSettings(boolean logRejections, int maxListedItems) {

    public static final String CONFIG_PATH = "trusted-sql";

    public static final String LOG_REJECTIONS = "diagnostics.log-rejections";

    public static final String MAX_LISTED_ITEMS = "diagnostics.max-listed-items";

    public DiagnosticSettings {
        Preconditions.checkArgument(maxListedItems >= 0, "maxListedItems must be >= 0, got: %s", maxListedItems);
    }

    /**
     * Reads the settings from {@link ConfigFactory#load()}, which caches the parsed configuration.
     * A malformed configuration throws {@link com.typesafe.config.ConfigException} on every call.
     */
    public static DiagnosticSettings defaults() {
        return load(ConfigFactory.load());
    }

    public static DiagnosticSettings load(Config config) {
        var conf = config.getConfig(CONFIG_PATH);
        return new DiagnosticSettings(conf.getBoolean(LOG_REJECTIONS), conf.getInt(MAX_LISTED_ITEMS));
    }
}
