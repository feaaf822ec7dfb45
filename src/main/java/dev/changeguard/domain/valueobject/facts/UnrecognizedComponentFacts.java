package dev.changeguard.domain.valueobject.facts;

/** Placeholder for a component type with no registered fact source. */
public record UnrecognizedComponentFacts(String componentType) implements ComponentFacts {
}
