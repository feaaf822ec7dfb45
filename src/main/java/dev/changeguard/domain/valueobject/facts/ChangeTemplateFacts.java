package dev.changeguard.domain.valueobject.facts;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Standard change template: the producer version plus the record producer it belongs to.
 * {@code successRate} is a percentage, null when the platform has no history yet.
 */
public record ChangeTemplateFacts(
        String versionSysId,
        String name,
        String producerSysId,
        boolean active,
        boolean published,
        String workflow,
        Instant lastUpdated,
        Double successRate,
        Integer closedChangeCount
) implements ComponentFacts {

    @Override
    @JsonProperty("componentType")
    public String componentType() {
        return ComponentTypes.STD_CHANGE_TEMPLATE;
    }
}
