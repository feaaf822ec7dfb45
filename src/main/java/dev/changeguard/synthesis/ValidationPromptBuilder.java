package dev.changeguard.synthesis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.changeguard.domain.valueobject.ChangeSnapshot;
import dev.changeguard.domain.valueobject.FactBundle;
import org.springframework.stereotype.Component;

/**
 * Builds the CAB review prompt for a change and its collected facts.
 */
@Component
public class ValidationPromptBuilder {

    static final String SYSTEM_PROMPT = """
            You are a Change Advisory Board reviewer for a ServiceNow platform team.
            Assess the change from the facts provided: documentation completeness, environment readiness,
            component configuration and downstream impact. Treat every check that is false as unresolved.
            Respond ONLY with JSON:
            {"overall_status":"APPROVE|APPROVE_WITH_CONDITIONS|REJECT",
             "documentation_assessment":"...",
             "risks":["..."],
             "required_actions":["..."],
             "synthesis":"..."}""";

    private final ObjectMapper objectMapper;

    public ValidationPromptBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    public String userPrompt(ChangeSnapshot change, FactBundle facts) {
        return """
                Evaluate the following change.

                Change Number: %s
                Component Type: %s
                Requested By: %s
                Data Source: %s

                <change_facts>
                %s
                </change_facts>""".formatted(
                change.changeNumber(),
                change.componentType(),
                change.requestedBy() != null ? change.requestedBy() : "Unknown",
                facts.dataSource(),
                toJson(facts));
    }

    private String toJson(FactBundle facts) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(facts);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Fact bundle is not serializable", e);
        }
    }
}
