package dev.changeguard.domain.valueobject;

import dev.changeguard.domain.valueobject.facts.ComponentFacts;
import dev.changeguard.domain.valueobject.facts.UnrecognizedComponentFacts;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything gathered about one change. Always fully shaped: a failed fetch shows up as an
 * entry in {@code collectionErrors} and a placeholder, never as a missing field.
 */
public record FactBundle(
        String componentType,
        String componentId,
        List<String> collectionErrors,
        EnvironmentHealth environmentHealth,
        ChangeContext changeContext,
        ComponentFacts componentFacts,
        Map<String, Boolean> checks
) {
    public FactBundle {
        Objects.requireNonNull(componentType, "componentType");
        Objects.requireNonNull(environmentHealth, "environmentHealth");
        Objects.requireNonNull(changeContext, "changeContext");
        Objects.requireNonNull(componentFacts, "componentFacts");
        collectionErrors = collectionErrors == null ? List.of() : List.copyOf(collectionErrors);
        checks = checks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(checks));
    }

    public boolean isComponentRecognized() {
        return !(componentFacts instanceof UnrecognizedComponentFacts);
    }

    /** "api" when every fetch succeeded, "archived" when the change context fell back, else "partial". */
    public String dataSource() {
        if (changeContext.isArchived()) return "archived";
        return collectionErrors.isEmpty() ? "api" : "partial";
    }
}
