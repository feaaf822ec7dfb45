package dev.changeguard.infrastructure.servicenow;

import dev.changeguard.config.ServiceNowProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Authenticates ServiceNow change webhooks against the shared secret.
 *
 * <p>Accepted, in order: the secret itself in a key header, the secret in the {@code code}
 * query parameter, or an HMAC-SHA256 of the raw body (hex or base64, optionally prefixed
 * with {@code sha256=}). Without a configured secret every request passes, which is only
 * meant for local development.
 * All comparisons are constant-time.
 */
@Component
public class WebhookAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(WebhookAuthenticator.class);
    private static final String HMAC_SHA256 = "HmacSHA256";

    public enum Method { NO_SECRET, API_KEY_HEADER, API_KEY_QUERY, HMAC_SIGNATURE }

    public record Credentials(String apiKey, String queryKey, String signature) {
    }

    public record AuthResult(boolean authenticated, Method method) {
        static AuthResult accepted(Method method) {
            return new AuthResult(true, method);
        }

        static AuthResult rejected() {
            return new AuthResult(false, null);
        }
    }

    private final ServiceNowProperties properties;

    public WebhookAuthenticator(ServiceNowProperties properties) {
        this.properties = properties;
    }

    public AuthResult authenticate(byte[] rawBody, Credentials credentials) {
        if (!properties.hasWebhookSecret()) {
            return AuthResult.accepted(Method.NO_SECRET);
        }
        byte[] secret = properties.webhookSecret().getBytes(StandardCharsets.UTF_8);

        if (matches(secret, credentials.apiKey())) return AuthResult.accepted(Method.API_KEY_HEADER);
        if (matches(secret, credentials.queryKey())) return AuthResult.accepted(Method.API_KEY_QUERY);

        String signature = credentials.signature();
        if (signature != null && !signature.isBlank()) {
            String presented = signature.trim();
            if (presented.regionMatches(true, 0, "sha256=", 0, 7)) presented = presented.substring(7);
            byte[] digest = hmac(secret, rawBody);
            if (digest != null && (matches(HexFormat.of().formatHex(digest).getBytes(StandardCharsets.UTF_8), presented.toLowerCase())
                    || matches(Base64.getEncoder().encode(digest), presented))) {
                return AuthResult.accepted(Method.HMAC_SIGNATURE);
            }
        }
        return AuthResult.rejected();
    }

    private static boolean matches(byte[] expected, String presented) {
        if (presented == null || presented.isEmpty()) return false;
        return MessageDigest.isEqual(expected, presented.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] hmac(byte[] secret, byte[] body) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(secret, HMAC_SHA256));
            return mac.doFinal(body);
        } catch (GeneralSecurityException e) {
            log.error("HMAC computation failed", e);
            return null;
        }
    }
}
