package uk.gegc.boxbilling.features.billing.api;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import uk.gegc.boxbilling.features.billing.domain.exception.WebhookSignatureException;
import uk.gegc.boxbilling.shared.api.problem.ErrorTypes;
import uk.gegc.boxbilling.shared.api.problem.ProblemDetailBuilder;
import uk.gegc.boxbilling.shared.exception.ResourceNotFoundException;
import uk.gegc.boxbilling.shared.exception.ValidationException;

/**
 * Error mapping for the billing API. Everything not handled here falls through to the global handler.
 */
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice(basePackages = "uk.gegc.boxbilling.features.billing.api")
public class BillingErrorHandler {

    @ExceptionHandler(WebhookSignatureException.class)
    public ResponseEntity<ProblemDetail> handleInvalidSignature(WebhookSignatureException ex, HttpServletRequest request) {
        log.warn("Invalid webhook signature: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.WEBHOOK_INVALID_SIGNATURE,
                "Webhook Invalid Signature",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ProblemDetail> handleInvalidEvent(ValidationException ex, HttpServletRequest request) {
        log.warn("Rejected billing request: {}", ex.getMessage());
        boolean webhook = isWebhookRequest(request);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                webhook ? ErrorTypes.INVALID_BILLING_EVENT : ErrorTypes.VALIDATION_FAILED,
                webhook ? "Invalid Billing Event" : "Validation Failed",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        log.warn("Billing resource not found: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.NOT_FOUND,
                ErrorTypes.RESOURCE_NOT_FOUND,
                "Resource Not Found",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problem);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ProblemDetail> handleIllegalState(IllegalStateException ex, HttpServletRequest request) {
        log.warn("Billing operation not allowed: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.CONFLICT,
                ErrorTypes.ILLEGAL_STATE,
                "Operation Not Allowed",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    private boolean isWebhookRequest(HttpServletRequest request) {
        String uri = request.getRequestURI();
        return uri != null && uri.contains("/billing/webhooks");
    }
}
