package org.proclient.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the client configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final File SYSTEM_CONFIG_FILE = new File("/etc/ubuntu-advantage/pro.conf");

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Java System Properties (e.g., -Dpro.data-dir=/tmp/pro)
     * 2. Environment Variables
     * 3. The file given with --config, if any
     * 4. The system-wide file /etc/ubuntu-advantage/pro.conf, if present
     * 5. Default values (from reference.conf on the classpath)
     *
     * @param explicitFile The file passed with --config, or null.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws IllegalArgumentException if an explicit file was given but does not exist.
     */
    public static Config load(final File explicitFile) {
        return load(explicitFile, SYSTEM_CONFIG_FILE);
    }

    static Config load(final File explicitFile, final File systemFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertiesConfig = ConfigFactory.systemProperties();

        final Config explicitConfig;
        if (explicitFile != null) {
            if (!explicitFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + explicitFile.getAbsolutePath());
            }
            LOG.debug("Loading configuration from file: {}", explicitFile.getAbsolutePath());
            explicitConfig = ConfigFactory.parseFile(explicitFile);
        } else {
            explicitConfig = ConfigFactory.empty();
        }

        final Config systemConfig;
        if (systemFile.isFile()) {
            LOG.debug("Loading configuration from file: {}", systemFile.getAbsolutePath());
            systemConfig = ConfigFactory.parseFile(systemFile);
        } else {
            systemConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources(ConfigLoader.class.getClassLoader(), "reference.conf");

        // Chain the configs together. The one provided first wins.
        return propertiesConfig
            .withFallback(envConfig)
            .withFallback(explicitConfig)
            .withFallback(systemConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
