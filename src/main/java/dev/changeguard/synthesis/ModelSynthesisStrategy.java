package dev.changeguard.synthesis;

import dev.changeguard.domain.enums.VerdictSource;
import dev.changeguard.domain.valueobject.ChangeSnapshot;
import dev.changeguard.domain.valueobject.FactBundle;
import dev.changeguard.domain.valueobject.Verdict;
import dev.changeguard.exception.SynthesisException;
import dev.changeguard.infrastructure.ai.LanguageModelClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Asks the language model for a CAB assessment. Checks are never taken from the model;
 * they always come from the collected facts.
 */
@Component
public class ModelSynthesisStrategy {

    private static final Logger log = LoggerFactory.getLogger(ModelSynthesisStrategy.class);

    private final LanguageModelClient modelClient;
    private final ValidationPromptBuilder promptBuilder;
    private final ModelResponseParser parser = new ModelResponseParser();

    public ModelSynthesisStrategy(LanguageModelClient modelClient, ValidationPromptBuilder promptBuilder) {
        this.modelClient = modelClient;
        this.promptBuilder = promptBuilder;
    }

    /** @throws SynthesisException if the model fails or its answer cannot be read */
    public Verdict synthesize(ChangeSnapshot change, FactBundle facts) {
        String answer = modelClient.complete(promptBuilder.systemPrompt(), promptBuilder.userPrompt(change, facts));
        ModelResponseParser.Result parsed = parser.parse(answer);
        if (!parsed.isSuccess()) {
            log.debug("Unreadable model answer for {}: {}", change.changeNumber(), answer);
            throw new SynthesisException("Could not read model answer: " + parsed.error());
        }
        ModelAssessment assessment = parsed.assessment();
        return new Verdict(assessment.overallStatus(), facts.checks(), assessment.synthesis(),
                assessment.requiredActions(), assessment.risks(), assessment.documentationAssessment(),
                VerdictSource.MODEL);
    }
}
