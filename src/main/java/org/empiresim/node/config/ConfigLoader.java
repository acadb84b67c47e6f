package org.empiresim.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the node configuration from its layered sources.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String DEFAULT_CONFIG_FILE = "empiresim.conf";

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads {@code empiresim.conf} from the working directory on top of the defaults.
     */
    public static Config load() {
        return load(new File(DEFAULT_CONFIG_FILE));
    }

    /**
     * Loads the configuration, highest precedence first:
     * <ol>
     *   <li>Environment variables</li>
     *   <li>System properties ({@code -Dkey=value})</li>
     *   <li>The given configuration file, skipped if it does not exist</li>
     *   <li>{@code reference.conf} on the classpath</li>
     * </ol>
     *
     * @param configFile The HOCON file, may be null.
     * @return The resolved configuration.
     */
    public static Config load(final File configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertiesConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile != null && configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.info("Configuration file '{}' not found. Using defaults.",
                configFile == null ? DEFAULT_CONFIG_FILE : configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        return envConfig
            .withFallback(propertiesConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
