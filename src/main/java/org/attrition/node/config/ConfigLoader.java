package org.attrition.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Builds the effective configuration. Earlier sources win:
 * <ol>
 *     <li>environment variables</li>
 *     <li>system properties ({@code -Dkey=value})</li>
 *     <li>the configuration file</li>
 *     <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String DEFAULT_CONFIG_FILE = "attrition.conf";

    private ConfigLoader() {
    }

    /**
     * Loads using {@code ./attrition.conf} when it exists.
     */
    public static Config load() {
        return load(new File(DEFAULT_CONFIG_FILE));
    }

    /**
     * Loads using the given file, skipped when it does not exist.
     */
    public static Config load(final File configFile) {
        final Config fileConfig;
        if (configFile != null && configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found, using defaults.", configFile);
            fileConfig = ConfigFactory.empty();
        }
        return ConfigFactory.systemEnvironment()
            .withFallback(ConfigFactory.systemProperties())
            .withFallback(fileConfig)
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }
}
