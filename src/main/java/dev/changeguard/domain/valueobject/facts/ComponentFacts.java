package dev.changeguard.domain.valueobject.facts;

/**
 * Component configuration as read from the ticketing platform, one variant per component type.
 * {@link UnavailableComponentFacts} stands in when the record could not be read and
 * {@link UnrecognizedComponentFacts} when no source is registered for the type.
 * New component types bring their own variant along with their fact source.
 */
public interface ComponentFacts {

    String componentType();
}
