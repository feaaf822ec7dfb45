package dev.changeguard.dto.request;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.JsonNode;
import dev.changeguard.domain.valueobject.DocumentationFields;
import dev.changeguard.domain.valueobject.facts.ComponentTypes;

import java.util.ArrayList;
import java.util.List;

/**
 * ServiceNow change webhook body. Reference fields may arrive as plain strings or as
 * {@code {"value", "display_value"}} objects; both are read as text.
 *
 * <p>When {@code component_sys_id} is absent the component id is taken from the nested
 * object named after the component type, e.g. {@code "catalog_item": {"sys_id": "..."}}.
 */
public record ChangeWebhookPayload(
        String changeSysId,
        String changeNumber,
        String state,
        String componentType,
        String componentSysId,
        String submittedBy,
        String shortDescription,
        String templateName,
        DocumentationFields documentation
) {

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ChangeWebhookPayload from(JsonNode root) {
        if (root == null || !root.isObject())
            throw new IllegalArgumentException("Webhook payload must be a JSON object");
        String componentType = text(root, "component_type");
        return new ChangeWebhookPayload(
                text(root, "change_sys_id"),
                text(root, "change_number"),
                text(root, "state"),
                componentType,
                componentId(root, componentType),
                text(root, "submitted_by"),
                text(root, "short_description"),
                templateName(root),
                new DocumentationFields(
                        text(root, "implementation_plan"),
                        firstText(root, "rollback_plan", "backout_plan", "back_out_plan"),
                        firstText(root, "test_plan", "testing_plan"),
                        firstText(root, "justification", "business_justification")));
    }

    /** Required fields that are absent or blank, in declaration order. */
    public List<String> missingRequiredFields() {
        List<String> missing = new ArrayList<>();
        if (changeSysId == null) missing.add("change_sys_id");
        if (changeNumber == null) missing.add("change_number");
        if (state == null) missing.add("state");
        if (componentType == null) missing.add("component_type");
        return missing;
    }

    private static String componentId(JsonNode root, String componentType) {
        String explicit = text(root, "component_sys_id");
        if (explicit != null || componentType == null) return explicit;
        String nested = referenceId(root.get(componentType));
        if (nested == null && ComponentTypes.STD_CHANGE_TEMPLATE.equals(componentType))
            nested = referenceId(root.get("std_change_producer_version"));
        return nested;
    }

    private static String templateName(JsonNode root) {
        JsonNode version = root.get("std_change_producer_version");
        if (version != null && version.isObject()) {
            String name = firstText(version, "display_value", "name");
            if (name != null) return name;
        }
        JsonNode template = root.get("template");
        if (template != null && template.isObject()) {
            String name = text(template, "name");
            if (name != null) return name;
        }
        return text(root, "short_description");
    }

    private static String referenceId(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isTextual()) return blankToNull(node.asText());
        if (node.isObject()) return firstText(node, "sys_id", "value");
        return null;
    }

    private static String firstText(JsonNode node, String... names) {
        for (String name : names) {
            String value = text(node, name);
            if (value != null) return value;
        }
        return null;
    }

    private static String text(JsonNode node, String name) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) return null;
        if (value.isObject()) {
            String display = text(value, "display_value");
            return display != null ? display : text(value, "value");
        }
        if (value.isContainerNode()) return null;
        return blankToNull(value.asText());
    }

    private static String blankToNull(String s) {
        if (s == null) return null;
        String trimmed = s.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
