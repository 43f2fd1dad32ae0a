package org.proclient.catalog;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ServiceCatalogTest {

    private static Service service(final String name, final List<String> requires) {
        return new Service(name, name.toUpperCase(), "", "help", Map.of("jammy", true), false, requires, List.of(), false);
    }

    @Test
    void constructor_rejectsDuplicateNames() {
        assertThatThrownBy(() -> new ServiceCatalog(List.of(service("a", List.of()), service("a", List.of()))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Duplicate");
    }

    @Test
    void constructor_rejectsReferencesToUnknownServices() {
        assertThatThrownBy(() -> new ServiceCatalog(List.of(service("a", List.of("missing")))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'missing'");
    }

    @Test
    void find_isCaseSensitive() {
        final ServiceCatalog catalog = new ServiceCatalog(List.of(service("esm-infra", List.of())));

        assertThat(catalog.find("esm-infra")).isPresent();
        assertThat(catalog.find("ESM-INFRA")).isEmpty();
    }

    @Test
    void enableOrder_putsRequiredServicesFirst() {
        final ServiceCatalog catalog = CatalogLoader.loadDefault();

        assertThat(catalog.enableOrder(Set.of("ros-updates", "ros", "esm-infra", "esm-apps")))
            .containsExactly("esm-apps", "esm-infra", "ros", "ros-updates");
        assertThat(catalog.disableOrder(Set.of("ros-updates", "ros", "esm-infra", "esm-apps")))
            .containsExactly("ros-updates", "ros", "esm-infra", "esm-apps");
    }

    @Test
    void dependentsOf_listsServicesRequiringTheGivenOne() {
        final ServiceCatalog catalog = CatalogLoader.loadDefault();

        assertThat(catalog.dependentsOf("esm-apps")).extracting(Service::name).containsExactly("ros", "ros-updates");
        assertThat(catalog.dependentsOf("livepatch")).isEmpty();
    }
}
