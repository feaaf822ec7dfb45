package dev.changeguard.domain.valueobject.facts;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record LdapServerFacts(
        String sysId,
        String name,
        boolean listenerEnabled,
        String midServer,
        List<String> urls,
        boolean pagingEnabled
) implements ComponentFacts {

    public LdapServerFacts {
        urls = urls == null ? List.of() : List.copyOf(urls);
    }

    @Override
    @JsonProperty("componentType")
    public String componentType() {
        return ComponentTypes.LDAP_SERVER;
    }
}
