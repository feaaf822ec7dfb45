package dev.changeguard.domain.valueobject;

/**
 * Immutable view of a validation request handed to collector and synthesizer threads,
 * so the managed entity never leaves the persistence layer.
 */
public record ChangeSnapshot(
        String changeId,
        String changeNumber,
        String componentType,
        String componentId,
        String requestedBy,
        String shortDescription,
        String templateName,
        DocumentationFields archivedDocumentation
) {
    public ChangeSnapshot {
        if (archivedDocumentation == null) archivedDocumentation = DocumentationFields.empty();
    }
}
