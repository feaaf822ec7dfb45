package dev.changeguard.synthesis;

import dev.changeguard.domain.enums.OverallStatus;

import java.util.List;

/** The model's verdict as read from its JSON answer. */
public record ModelAssessment(
        OverallStatus overallStatus,
        String documentationAssessment,
        List<String> risks,
        List<String> requiredActions,
        String synthesis
) {
    public ModelAssessment {
        risks = risks == null ? List.of() : List.copyOf(risks);
        requiredActions = requiredActions == null ? List.of() : List.copyOf(requiredActions);
    }
}
