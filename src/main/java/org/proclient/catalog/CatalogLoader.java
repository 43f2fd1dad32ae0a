package org.proclient.catalog;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@link ServiceCatalog} from a HOCON definition.
 * <p>
 * The bundled definition lives in {@code catalog.conf} on the classpath:
 * <pre>
 * services = [
 *   {
 *     name = "esm-infra"
 *     title = "Ubuntu Pro: ESM Infra"
 *     description = "Expanded Security Maintenance for Infrastructure"
 *     help = "..."
 *     releases { xenial = true, bionic = true }
 *     beta = false
 *     requires = []
 *     incompatible = []
 *     reboot-on-enable = false
 *   }
 * ]
 * </pre>
 */
public final class CatalogLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogLoader.class);
    private static final String CATALOG_RESOURCE = "catalog.conf";
    private static final String SERVICES_PATH = "services";

    private CatalogLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the catalog bundled with the client.
     *
     * @return The immutable service catalog.
     * @throws IllegalStateException if the bundled resource is missing or malformed.
     */
    public static ServiceCatalog loadDefault() {
        final Config config = ConfigFactory.parseResources(CatalogLoader.class.getClassLoader(), CATALOG_RESOURCE);
        if (!config.hasPath(SERVICES_PATH)) {
            throw new IllegalStateException("Service catalog resource '" + CATALOG_RESOURCE + "' is missing or empty");
        }
        return load(config);
    }

    /**
     * Builds a catalog from an already parsed configuration.
     *
     * @param config A configuration with a top-level {@code services} list.
     * @return The immutable service catalog.
     * @throws IllegalStateException if an entry is malformed.
     */
    public static ServiceCatalog load(final Config config) {
        final List<Service> services = new ArrayList<>();
        try {
            for (final Config entry : config.getConfigList(SERVICES_PATH)) {
                services.add(toService(entry));
            }
        } catch (final ConfigException e) {
            throw new IllegalStateException("Malformed service catalog: " + e.getMessage(), e);
        }
        LOGGER.debug("Loaded {} services into the catalog.", services.size());
        return new ServiceCatalog(services);
    }

    private static Service toService(final Config entry) {
        final Map<String, Boolean> releases = new LinkedHashMap<>();
        if (entry.hasPath("releases")) {
            for (final Map.Entry<String, ConfigValue> release : entry.getConfig("releases").root().entrySet()) {
                releases.put(release.getKey(), Boolean.parseBoolean(release.getValue().unwrapped().toString()));
            }
        }
        return new Service(
            entry.getString("name"),
            entry.getString("title"),
            entry.hasPath("description") ? entry.getString("description") : "",
            entry.getString("help"),
            releases,
            entry.hasPath("beta") && entry.getBoolean("beta"),
            entry.hasPath("requires") ? entry.getStringList("requires") : List.of(),
            entry.hasPath("incompatible") ? entry.getStringList("incompatible") : List.of(),
            entry.hasPath("reboot-on-enable") && entry.getBoolean("reboot-on-enable")
        );
    }
}
