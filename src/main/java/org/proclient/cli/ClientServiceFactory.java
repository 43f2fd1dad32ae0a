package org.proclient.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import org.proclient.catalog.CatalogLoader;
import org.proclient.catalog.ServiceCatalog;
import org.proclient.contract.HttpContractClient;
import org.proclient.operation.handler.EntitlementActionHandler;
import org.proclient.spi.IAttachmentStateStore;
import org.proclient.spi.IContractClient;
import org.proclient.spi.IServiceActionHandler;
import org.proclient.spi.ServiceRegistry;
import org.proclient.state.FileAttachmentStateStore;
import org.proclient.system.MachineIdProvider;
import org.proclient.system.OsReleaseReader;
import org.proclient.system.RebootRequiredCheck;
import org.proclient.system.ReleaseInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Creates the production collaborators of the CLI from the client configuration.
 * Every collaborator is registered lazily, so a command only touches the files and
 * endpoints it actually needs.
 */
public final class ClientServiceFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClientServiceFactory.class);

    private ClientServiceFactory() {
        // Private constructor to prevent instantiation
    }

    /**
     * Builds a registry wired from the {@code pro} configuration block.
     *
     * @param config The resolved client configuration.
     * @return A registry holding the catalog, state store, contract client and system readers.
     */
    public static ServiceRegistry create(final Config config) {
        final Config pro = config.getConfig("pro");
        final Path dataDir = Path.of(pro.getString("data-dir"));
        final ServiceRegistry registry = new ServiceRegistry();

        registry.register(ObjectMapper.class, new ObjectMapper());
        registry.registerLazy(ServiceCatalog.class, CatalogLoader::loadDefault);
        registry.registerLazy(IServiceActionHandler.class,
            () -> new EntitlementActionHandler(registry.get(ServiceCatalog.class)));
        registry.registerLazy(IAttachmentStateStore.class, () -> new FileAttachmentStateStore(dataDir));
        registry.registerLazy(IContractClient.class, () -> new HttpContractClient(
            URI.create(pro.getString("contract-url")), pro.getDuration("http.timeout")));
        registry.registerLazy(ReleaseInfo.class, () -> readRelease(pro));
        registry.registerLazy(MachineIdProvider.class, () -> new MachineIdProvider(dataDir));
        registry.registerLazy(RebootRequiredCheck.class,
            () -> new RebootRequiredCheck(Path.of(pro.getString("reboot-required-file"))));
        return registry;
    }

    /**
     * Reads the release from {@code pro.release} when it is configured, else from os-release.
     */
    static ReleaseInfo readRelease(final Config pro) {
        if (pro.hasPath("release.version") && pro.hasPath("release.series")) {
            final ReleaseInfo release = new ReleaseInfo(
                pro.getString("release.version"), pro.getString("release.series"));
            LOGGER.debug("Using configured release {}", release.displayName());
            return release;
        }
        final Path osRelease = Path.of(pro.getString("os-release-file"));
        try {
            return ReleaseInfo.fromOsRelease(OsReleaseReader.read(osRelease));
        } catch (final IOException e) {
            throw new IllegalStateException("Failed to read release information from " + osRelease, e);
        }
    }
}
