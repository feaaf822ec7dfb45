package dev.changeguard.domain.valueobject.facts;

import com.fasterxml.jackson.annotation.JsonProperty;

public record WorkflowFacts(
        String sysId,
        String name,
        boolean published,
        boolean checkedOut,
        String scope,
        String description
) implements ComponentFacts {

    @Override
    @JsonProperty("componentType")
    public String componentType() {
        return ComponentTypes.WORKFLOW;
    }
}
