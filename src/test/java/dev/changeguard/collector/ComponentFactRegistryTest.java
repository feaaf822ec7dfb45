package dev.changeguard.collector;

import dev.changeguard.collector.source.CatalogItemFactSource;
import dev.changeguard.collector.source.ComponentFactSource;
import dev.changeguard.collector.source.WorkflowFactSource;
import dev.changeguard.domain.valueobject.facts.ComponentFacts;
import dev.changeguard.infrastructure.servicenow.TicketClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class ComponentFactRegistryTest {

    private final TicketClient ticketClient = mock(TicketClient.class);

    @Test
    @DisplayName("looks sources up by type, ignoring case and whitespace")
    void lookup() {
        ComponentFactRegistry registry = new ComponentFactRegistry(List.of(
                new CatalogItemFactSource(ticketClient), new WorkflowFactSource(ticketClient)));

        assertThat(registry.find(" Catalog_Item ")).get().isInstanceOf(CatalogItemFactSource.class);
        assertThat(registry.find("load_balancer")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
        assertThat(registry.componentTypes()).containsExactlyInAnyOrder("catalog_item", "workflow");
    }

    @Test
    @DisplayName("new component types can be registered without other changes")
    void registerNewType() {
        ComponentFactRegistry registry = new ComponentFactRegistry(List.of());
        registry.register(new LoadBalancerSource());

        assertThat(registry.find("load_balancer")).isPresent();
    }

    @Test
    @DisplayName("two sources for one type are rejected")
    void duplicateType() {
        ComponentFactRegistry registry = new ComponentFactRegistry(List.of(new CatalogItemFactSource(ticketClient)));

        assertThatThrownBy(() -> registry.register(new CatalogItemFactSource(ticketClient)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("catalog_item");
    }

    private record LoadBalancerFacts(String name, int poolSize) implements ComponentFacts {
        @Override public String componentType() { return "load_balancer"; }
    }

    private static class LoadBalancerSource implements ComponentFactSource<LoadBalancerFacts> {
        @Override public String componentType() { return "load_balancer"; }
        @Override public List<String> checkNames() { return List.of("has_pool"); }
        @Override public Optional<LoadBalancerFacts> fetch(String componentId) { return Optional.empty(); }
        @Override public Map<String, Boolean> deriveChecks(LoadBalancerFacts facts) {
            return Map.of("has_pool", facts.poolSize() > 0);
        }
    }
}
