package dev.changeguard.synthesis;

import dev.changeguard.domain.enums.OverallStatus;
import dev.changeguard.domain.enums.VerdictSource;
import dev.changeguard.domain.valueobject.ChangeContext;
import dev.changeguard.domain.valueobject.DocumentationFields;
import dev.changeguard.domain.valueobject.EnvironmentHealth;
import dev.changeguard.domain.valueobject.FactBundle;
import dev.changeguard.domain.valueobject.Verdict;
import dev.changeguard.domain.valueobject.facts.ComponentFacts;
import dev.changeguard.domain.valueobject.facts.UnavailableComponentFacts;
import dev.changeguard.domain.valueobject.facts.UnrecognizedComponentFacts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RulesSynthesisStrategyTest {

    private final RulesSynthesisStrategy strategy = new RulesSynthesisStrategy();

    static FactBundle bundle(String type, ComponentFacts facts, Map<String, Boolean> checks, ChangeContext context) {
        return new FactBundle(type, "id-1", List.of(), EnvironmentHealth.skipped(null, null, "n/a"),
                context, facts, checks);
    }

    static ChangeContext documentedContext() {
        return new ChangeContext("CHG0001", "assess", "Update item", "moderate",
                new DocumentationFields("deploy", "revert", "smoke test", "business need"), ChangeContext.LIVE);
    }

    private static Map<String, Boolean> checks(Object... pairs) {
        Map<String, Boolean> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) map.put((String) pairs[i], (Boolean) pairs[i + 1]);
        return map;
    }

    @Nested
    @DisplayName("statusFor")
    class StatusFor {

        @Test
        @DisplayName("no checks is a WARNING")
        void emptyIsWarning() {
            assertThat(RulesSynthesisStrategy.statusFor(Map.of())).isEqualTo(OverallStatus.WARNING);
        }

        @Test
        @DisplayName("all true is PASSED")
        void allTrue() {
            assertThat(RulesSynthesisStrategy.statusFor(checks("has_name", true, "recently_checked_in", true)))
                    .isEqualTo(OverallStatus.PASSED);
        }

        @Test
        @DisplayName("a false has_ or is_ check is FAILED")
        void hardRequirementFails() {
            assertThat(RulesSynthesisStrategy.statusFor(checks("has_name", true, "is_active", false)))
                    .isEqualTo(OverallStatus.FAILED);
            assertThat(RulesSynthesisStrategy.statusFor(checks("has_workflow", false)))
                    .isEqualTo(OverallStatus.FAILED);
        }

        @Test
        @DisplayName("only soft checks false is a WARNING")
        void softChecksWarn() {
            assertThat(RulesSynthesisStrategy.statusFor(checks("is_up", true, "recently_checked_in", false)))
                    .isEqualTo(OverallStatus.WARNING);
        }

        @Test
        @DisplayName("the prefix must start the name")
        void prefixIsAnchored() {
            assertThat(RulesSynthesisStrategy.statusFor(checks("not_checked_out", false, "this_is_soft", false)))
                    .isEqualTo(OverallStatus.WARNING);
        }
    }

    @Test
    @DisplayName("a failing catalog item lists every failed check as a remediation step")
    void failingCatalogItem() {
        Verdict verdict = strategy.synthesize(bundle("catalog_item",
                new UnavailableComponentFacts("catalog_item", "id-1", "not found"),
                checks("has_name", false, "has_category", false, "has_workflow", false, "is_active", false),
                documentedContext()));

        assertThat(verdict.overallStatus()).isEqualTo(OverallStatus.FAILED);
        assertThat(verdict.source()).isEqualTo(VerdictSource.RULES);
        assertThat(verdict.remediationSteps()).containsExactly(
                "Resolve configuration gap: has name",
                "Resolve configuration gap: has category",
                "Resolve configuration gap: has workflow",
                "Resolve configuration gap: is active");
        assertThat(verdict.synthesis()).startsWith("Change validation failed.");
        assertThat(verdict.checks()).containsOnlyKeys("has_name", "has_category", "has_workflow", "is_active");
    }

    @Test
    @DisplayName("a passing bundle has no remediation steps")
    void passing() {
        Verdict verdict = strategy.synthesize(bundle("catalog_item",
                new UnavailableComponentFacts("catalog_item", "id-1", "unused"),
                checks("has_name", true, "is_active", true), documentedContext()));

        assertThat(verdict.overallStatus()).isEqualTo(OverallStatus.PASSED);
        assertThat(verdict.remediationSteps()).isEmpty();
        assertThat(verdict.synthesis()).contains("All 2 configuration checks");
        assertThat(verdict.documentationAssessment()).startsWith("Implementation plan");
    }

    @Test
    @DisplayName("an unrecognized component type is a WARNING with a manual-review step")
    void unrecognizedType() {
        Verdict verdict = strategy.synthesize(bundle("load_balancer",
                new UnrecognizedComponentFacts("load_balancer"), Map.of(), documentedContext()));

        assertThat(verdict.overallStatus()).isEqualTo(OverallStatus.WARNING);
        assertThat(verdict.synthesis()).contains("'load_balancer' is not recognized");
        assertThat(verdict.remediationSteps()).containsExactly(RulesSynthesisStrategy.UNRECOGNIZED_ACTION);
    }

    @Test
    @DisplayName("missing documentation is assessed and flagged when archived")
    void documentationAssessment() {
        ChangeContext archived = new ChangeContext("CHG0001", null, null, null,
                new DocumentationFields("deploy", null, null, "why"), ChangeContext.ARCHIVED);

        Verdict verdict = strategy.synthesize(bundle("catalog_item",
                new UnavailableComponentFacts("catalog_item", "id-1", "x"), checks("has_name", true), archived));

        assertThat(verdict.documentationAssessment())
                .isEqualTo("Missing documentation: rollback plan, test plan. Assessed from the archived webhook payload.");
    }

    @Test
    @DisplayName("same checks always produce the same verdict")
    void deterministic() {
        FactBundle facts = bundle("mid_server", new UnavailableComponentFacts("mid_server", "id-1", "x"),
                checks("is_up", true, "has_capabilities", true, "recently_checked_in", false), documentedContext());

        assertThat(strategy.synthesize(facts)).isEqualTo(strategy.synthesize(facts));
    }
}
