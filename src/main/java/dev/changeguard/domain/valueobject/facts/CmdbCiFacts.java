package dev.changeguard.domain.valueobject.facts;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Configuration item with its first-degree relationships. */
public record CmdbCiFacts(
        String sysId,
        String name,
        String className,
        String owner,
        String environment,
        String operationalStatus,
        String installStatus,
        String businessCriticality,
        List<Relationship> relationships
) implements ComponentFacts {

    public CmdbCiFacts {
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
    }

    @Override
    @JsonProperty("componentType")
    public String componentType() {
        return ComponentTypes.CMDB_CI;
    }

    public record Relationship(String type, String parent, String child) {
    }
}
