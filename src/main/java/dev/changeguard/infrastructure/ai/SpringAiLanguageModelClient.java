package dev.changeguard.infrastructure.ai;

import dev.changeguard.config.AiProperties;
import dev.changeguard.exception.SynthesisException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bedrock Converse (via Spring AI) behind {@link LanguageModelClient}.
 *
 * <p>Every failure mode is reported as {@link SynthesisException} so the synthesizer can fall
 * back to rules. The circuit breaker stops hammering Bedrock once it is clearly down.
 */
@Component
public class SpringAiLanguageModelClient implements LanguageModelClient {

    private static final Logger log = LoggerFactory.getLogger(SpringAiLanguageModelClient.class);

    private final AiProperties aiProperties;
    private final ObjectProvider<ChatModel> chatModel;
    private final ExecutorService executor;

    public SpringAiLanguageModelClient(AiProperties aiProperties, ObjectProvider<ChatModel> chatModel,
                                       @Qualifier("modelExecutor") ExecutorService executor) {
        this.aiProperties = aiProperties;
        this.chatModel = chatModel;
        this.executor = executor;
    }

    @Override
    @CircuitBreaker(name = "language-model")
    public String complete(String systemPrompt, String userPrompt) {
        ChatModel model = chatModel.getIfAvailable();
        if (model == null) throw new SynthesisException("No chat model configured");

        ChatOptions options = ChatOptions.builder()
                .model(aiProperties.model())
                .temperature(aiProperties.temperature())
                .maxTokens(aiProperties.maxOutputTokens())
                .build();
        Prompt prompt = new Prompt(List.of(new SystemMessage(systemPrompt), new UserMessage(userPrompt)), options);

        CompletableFuture<ChatResponse> call = CompletableFuture.supplyAsync(() -> model.call(prompt), executor);
        ChatResponse response;
        try {
            response = call.get(aiProperties.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new SynthesisException("Model call timed out after " + aiProperties.timeout().toMillis() + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SynthesisException("Interrupted while waiting for the model", e);
        } catch (ExecutionException e) {
            throw new SynthesisException("Model call failed: " + e.getCause().getMessage(), e.getCause());
        }

        String text = response == null || response.getResult() == null
                ? null : response.getResult().getOutput().getText();
        if (text == null || text.isBlank()) throw new SynthesisException("Model returned an empty answer");
        log.debug("Model {} answered with {} chars", aiProperties.model(), text.length());
        return text;
    }
}
