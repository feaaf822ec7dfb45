package dev.changeguard.synthesis;

import dev.changeguard.config.AiProperties;
import dev.changeguard.domain.enums.OverallStatus;
import dev.changeguard.domain.valueobject.ChangeSnapshot;
import dev.changeguard.domain.valueobject.FactBundle;
import dev.changeguard.domain.valueobject.Verdict;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns a fact bundle into a verdict: model first, rules when the model is disabled, fails,
 * or the component type is unknown.
 *
 * <p>A model may not pass a change the rules would not pass: a PASSED answer over failing
 * checks is downgraded to the rules status. Non-PASSED verdicts always carry at least one
 * remediation step.
 */
@Component
public class Synthesizer {

    private static final Logger log = LoggerFactory.getLogger(Synthesizer.class);

    private final ModelSynthesisStrategy modelStrategy;
    private final RulesSynthesisStrategy rulesStrategy;
    private final AiProperties aiProperties;
    private final Counter fallbackCounter;

    public Synthesizer(ModelSynthesisStrategy modelStrategy, RulesSynthesisStrategy rulesStrategy,
                       AiProperties aiProperties, MeterRegistry meterRegistry) {
        this.modelStrategy = modelStrategy;
        this.rulesStrategy = rulesStrategy;
        this.aiProperties = aiProperties;
        this.fallbackCounter = Counter.builder("changeguard.synthesis.fallback")
                .description("Verdicts produced by rules after the model failed")
                .register(meterRegistry);
    }

    public Verdict synthesize(ChangeSnapshot change, FactBundle facts) {
        Verdict rules = rulesStrategy.synthesize(facts);
        if (!facts.isComponentRecognized() || !aiProperties.enabled()) {
            return rules;
        }
        try {
            return reconcile(modelStrategy.synthesize(change, facts), rules);
        } catch (RuntimeException e) {
            fallbackCounter.increment();
            log.warn("Model synthesis failed for change {}, using rules: {}", change.changeNumber(), e.getMessage());
            return rules;
        }
    }

    private static Verdict reconcile(Verdict model, Verdict rules) {
        OverallStatus status = model.overallStatus();
        if (status == OverallStatus.PASSED && rules.overallStatus() != OverallStatus.PASSED) {
            log.info("Model passed a change with failing checks {}; using {}", rules.failedChecks(), rules.overallStatus());
            status = rules.overallStatus();
        }
        List<String> remediation = model.remediationSteps();
        if (status != OverallStatus.PASSED && remediation.isEmpty()) {
            remediation = rules.remediationSteps().isEmpty()
                    ? List.of(RulesSynthesisStrategy.DOCUMENTATION_ACTION)
                    : rules.remediationSteps();
        }
        String synthesis = model.synthesis() != null ? model.synthesis() : rules.synthesis();
        String documentation = model.documentationAssessment() != null
                ? model.documentationAssessment() : rules.documentationAssessment();
        return new Verdict(status, model.checks(), synthesis, remediation, model.risks(), documentation, model.source());
    }
}
