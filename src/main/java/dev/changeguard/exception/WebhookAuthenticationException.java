package dev.changeguard.exception;

public class WebhookAuthenticationException extends ChangeGuardException {

    public WebhookAuthenticationException(String message) {
        super(message);
    }
}
