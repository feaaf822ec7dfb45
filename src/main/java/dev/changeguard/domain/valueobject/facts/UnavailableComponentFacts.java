package dev.changeguard.domain.valueobject.facts;

/** Placeholder for a recognised component whose record could not be read. */
public record UnavailableComponentFacts(String componentType, String componentId, String reason)
        implements ComponentFacts {
}
