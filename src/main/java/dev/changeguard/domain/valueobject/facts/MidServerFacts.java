package dev.changeguard.domain.valueobject.facts;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record MidServerFacts(
        String sysId,
        String name,
        String status,
        String version,
        List<String> capabilities,
        Instant lastCheckIn
) implements ComponentFacts {

    public MidServerFacts {
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }

    @Override
    @JsonProperty("componentType")
    public String componentType() {
        return ComponentTypes.MID_SERVER;
    }
}
