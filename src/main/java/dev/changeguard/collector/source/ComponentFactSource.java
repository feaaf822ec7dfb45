package dev.changeguard.collector.source;

import dev.changeguard.domain.valueobject.facts.ComponentFacts;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fetches one component type's record and derives its checks.
 *
 * <p>Implementations are registered with {@link dev.changeguard.collector.ComponentFactRegistry}
 * by type key; supporting a new component type means adding a source, nothing else.
 *
 * @param <F> the facts variant this source produces
 */
public interface ComponentFactSource<F extends ComponentFacts> {

    /** Key matched against the webhook's {@code component_type}. */
    String componentType();

    /** Every check this source can derive, in reporting order. */
    List<String> checkNames();

    /**
     * @return empty when the record does not exist
     * @throws RuntimeException on transport failure
     */
    Optional<F> fetch(String componentId);

    Map<String, Boolean> deriveChecks(F facts);
}
