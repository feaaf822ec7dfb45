package dev.changeguard.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Ticket metadata for the change under validation.
 * {@code source} is "ticket_system" when read live, "archived" when rebuilt from the webhook payload.
 */
public record ChangeContext(
        String changeNumber,
        String state,
        String shortDescription,
        String riskLevel,
        DocumentationFields documentation,
        String source
) {
    public static final String LIVE = "ticket_system";
    public static final String ARCHIVED = "archived";

    public ChangeContext {
        if (documentation == null) documentation = DocumentationFields.empty();
    }

    public boolean isArchived() {
        return ARCHIVED.equals(source);
    }

    @JsonProperty("missingDocumentation")
    public List<String> missingDocumentation() {
        return documentation.missing();
    }
}
