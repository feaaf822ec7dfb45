package dev.changeguard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "changeguard.servicenow")
public record ServiceNowProperties(String instanceUrl, String username, String password, String webhookSecret) {

    public boolean hasWebhookSecret() {
        return webhookSecret != null && !webhookSecret.isBlank();
    }
}
