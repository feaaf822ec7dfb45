package dev.changeguard.collector;

import dev.changeguard.collector.source.ComponentFactSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routing table from component type to its fact source. Populated from every
 * {@link ComponentFactSource} bean; more can be added at runtime with {@link #register}.
 */
@Component
public class ComponentFactRegistry {

    private static final Logger log = LoggerFactory.getLogger(ComponentFactRegistry.class);

    private final Map<String, ComponentFactSource<?>> sources = new ConcurrentHashMap<>();

    public ComponentFactRegistry(List<ComponentFactSource<?>> sources) {
        sources.forEach(this::register);
        log.info("Component fact sources registered: {}", new TreeSet<>(this.sources.keySet()));
    }

    /** @throws IllegalStateException if the type already has a source */
    public void register(ComponentFactSource<?> source) {
        String type = normalize(source.componentType());
        ComponentFactSource<?> existing = sources.putIfAbsent(type, source);
        if (existing != null && existing != source)
            throw new IllegalStateException("Component type '%s' already handled by %s"
                    .formatted(type, existing.getClass().getSimpleName()));
    }

    public Optional<ComponentFactSource<?>> find(String componentType) {
        if (componentType == null) return Optional.empty();
        return Optional.ofNullable(sources.get(normalize(componentType)));
    }

    public Set<String> componentTypes() {
        return Set.copyOf(sources.keySet());
    }

    private static String normalize(String type) {
        return type.trim().toLowerCase();
    }
}
