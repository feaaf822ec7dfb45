package dev.changeguard.exception;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.time.Instant;

/**
 * Maps pipeline exceptions to RFC 7807 Problem Details.
 *
 * <p>Internal messages are not exposed on 5xx responses; details stay in the server log.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleMalformedBody(HttpMessageNotReadableException ex) {
        log.warn("Malformed request body: {}", ex.getMostSpecificCause().getMessage());
        return problem(HttpStatus.BAD_REQUEST, "malformed-body", "Malformed Request",
                "Request body is not valid JSON");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleBadRequest(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "bad-request", "Invalid Request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return problem(HttpStatus.BAD_REQUEST, "bad-request", "Invalid Request",
                "Invalid value for parameter '%s'".formatted(ex.getName()));
    }

    @ExceptionHandler(WebhookAuthenticationException.class)
    public ProblemDetail handleUnauthorized(WebhookAuthenticationException ex) {
        log.warn("Webhook rejected: {}", ex.getMessage());
        return problem(HttpStatus.UNAUTHORIZED, "unauthorized", "Unauthorized", ex.getMessage());
    }

    @ExceptionHandler(PayloadValidationException.class)
    public ProblemDetail handleInvalidPayload(PayloadValidationException ex) {
        log.warn("Invalid webhook payload: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.UNPROCESSABLE_ENTITY, "invalid-payload",
                "Invalid Payload", ex.getMessage());
        problem.setProperty("missingFields", ex.getMissingFields());
        return problem;
    }

    @ExceptionHandler(ValidationNotFoundException.class)
    public ProblemDetail handleNotFound(ValidationNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "not-found", "Not Found", ex.getMessage());
    }

    @ExceptionHandler(DuplicateValidationException.class)
    public ProblemDetail handleDuplicate(DuplicateValidationException ex) {
        log.warn("Duplicate validation: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "duplicate", "Duplicate Validation", ex.getMessage());
    }

    @ExceptionHandler({StoreUnavailableException.class, CallNotPermittedException.class})
    public ProblemDetail handleUnavailable(RuntimeException ex) {
        log.error("Dependency unavailable: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "service-unavailable", "Service Unavailable",
                "Service temporarily unavailable. Please retry later.");
    }

    @ExceptionHandler(ValidationProcessingException.class)
    public ProblemDetail handleProcessingFailure(ValidationProcessingException ex) {
        log.error("Processing failed for change {}", ex.getChangeId(), ex.getCause());
        ProblemDetail problem = problem(HttpStatus.INTERNAL_SERVER_ERROR, "processing-failed",
                "Processing Failed", "Validation could not be completed and will be retried by the caller.");
        problem.setProperty("changeId", ex.getChangeId());
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "internal-error", "Internal Server Error",
                "An unexpected error occurred.");
    }

    private static ProblemDetail problem(HttpStatus status, String type, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create("https://changeguard.dev/errors/" + type));
        problem.setTitle(title);
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }
}
