package dev.changeguard.domain.valueobject.facts;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CatalogItemFacts(
        String sysId,
        String name,
        String shortDescription,
        String category,
        String workflow,
        String owner,
        boolean active,
        String lastUpdated
) implements ComponentFacts {

    @Override
    @JsonProperty("componentType")
    public String componentType() {
        return ComponentTypes.CATALOG_ITEM;
    }
}
