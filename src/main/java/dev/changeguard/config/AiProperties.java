package dev.changeguard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Language-model settings. With {@code enabled=false} every verdict comes from the rules.
 */
@ConfigurationProperties(prefix = "changeguard.ai")
public record AiProperties(boolean enabled, String model, int maxOutputTokens, Double temperature, Duration timeout) {
    public AiProperties {
        if (maxOutputTokens <= 0) maxOutputTokens = 2048;
        if (temperature == null) temperature = 0.1;
        if (timeout == null) timeout = Duration.ofSeconds(30);
    }
}
