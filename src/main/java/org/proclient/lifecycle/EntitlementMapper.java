package org.proclient.lifecycle;

import org.proclient.catalog.ServiceCatalog;
import org.proclient.contract.ContractEntitlement;
import org.proclient.contract.ContractInfo;
import org.proclient.operation.ErrorEntry;
import org.proclient.operation.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps contract entitlements onto catalog services.
 */
final class EntitlementMapper {

    private static final Logger LOGGER = LoggerFactory.getLogger(EntitlementMapper.class);

    private EntitlementMapper() {
        // Private constructor to prevent instantiation
    }

    /**
     * Collects the entitled services the catalog knows. Entitlements of unknown types are
     * reported as warnings and otherwise ignored.
     *
     * @param contract The contract.
     * @param catalog  The service catalog.
     * @param warnings Receives one warning per unknown entitlement type.
     * @return Entitled service names in contract order.
     */
    static Set<String> entitledServices(final ContractInfo contract, final ServiceCatalog catalog,
                                        final List<ErrorEntry> warnings) {
        final Set<String> entitled = new LinkedHashSet<>();
        for (final ContractEntitlement entitlement : contract.entitlements()) {
            if (!entitlement.entitled()) {
                continue;
            }
            if (!catalog.contains(entitlement.type())) {
                LOGGER.debug("Contract entitles unknown service type '{}'", entitlement.type());
                warnings.add(Message.ENTITLEMENT_NOT_IN_CATALOG.asSystemError(entitlement.type()));
                continue;
            }
            entitled.add(entitlement.type());
        }
        return entitled;
    }
}
