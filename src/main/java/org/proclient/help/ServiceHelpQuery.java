package org.proclient.help;

import org.proclient.catalog.Service;
import org.proclient.catalog.ServiceCatalog;
import org.proclient.system.ReleaseInfo;

/**
 * Answers {@code pro help <service>}.
 * <p>
 * Availability comes from the catalog and the current release only; attachment plays no
 * role, so the same help text is returned whether or not the service can be used here.
 */
public class ServiceHelpQuery {

    private final ServiceCatalog catalog;
    private final ReleaseInfo release;

    public ServiceHelpQuery(final ServiceCatalog catalog, final ReleaseInfo release) {
        this.catalog = catalog;
        this.release = release;
    }

    /**
     * Looks up help for a service.
     *
     * @param name The exact service name.
     * @return The help content.
     * @throws HelpNotFoundException if the catalog has no such service.
     */
    public ServiceHelp query(final String name) throws HelpNotFoundException {
        final Service service = catalog.find(name).orElseThrow(() -> new HelpNotFoundException(name));
        return new ServiceHelp(service.name(), service.isAvailableOn(release.series()) ? "yes" : "no", service.helpText());
    }
}
