package dev.changeguard.infrastructure.ai;

/**
 * Text-in, text-out access to a language model.
 */
public interface LanguageModelClient {

    /**
     * @return the raw model answer
     * @throws dev.changeguard.exception.SynthesisException on timeout, transport failure or an empty answer
     */
    String complete(String systemPrompt, String userPrompt);
}
