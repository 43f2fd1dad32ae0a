package org.proclient.status;

import org.proclient.catalog.Service;
import org.proclient.catalog.ServiceCatalog;
import org.proclient.state.AttachmentState;
import org.proclient.system.ReleaseInfo;
import org.proclient.system.RebootRequiredCheck;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the {@link StatusReport} shown by {@code pro status}.
 */
public class StatusQuery {

    private final ServiceCatalog catalog;
    private final ReleaseInfo release;
    private final RebootRequiredCheck rebootCheck;

    public StatusQuery(final ServiceCatalog catalog, final ReleaseInfo release, final RebootRequiredCheck rebootCheck) {
        this.catalog = catalog;
        this.release = release;
        this.rebootCheck = rebootCheck;
    }

    /**
     * Builds the report.
     *
     * @param state       The current attachment state.
     * @param includeBeta Whether beta services are listed.
     * @return The report.
     */
    public StatusReport query(final AttachmentState state, final boolean includeBeta) {
        final List<ServiceStatusEntry> entries = new ArrayList<>();
        for (final Service service : catalog.all()) {
            if (service.beta() && !includeBeta) {
                continue;
            }
            final boolean available = service.isAvailableOn(release.series());
            final boolean entitled = state.attached() && state.isEntitledTo(service.name());
            final String status;
            if (!available || !entitled) {
                status = "n/a";
            } else {
                status = state.isEnabled(service.name()) ? "enabled" : "disabled";
            }
            entries.add(new ServiceStatusEntry(
                service.name(), yesNo(entitled), status, yesNo(available), service.description()));
        }
        return new StatusReport(state.attached(), state.accountName(), state.contractName(),
            release.displayName(), rebootCheck.isRebootRequired(), entries);
    }

    private static String yesNo(final boolean value) {
        return value ? "yes" : "no";
    }
}
