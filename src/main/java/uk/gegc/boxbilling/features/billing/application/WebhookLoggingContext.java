package uk.gegc.boxbilling.features.billing.application;

import lombok.Builder;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Structured logging context for webhook processing.
 * Provides consistent logging fields across all webhook handlers.
 */
@Data
@Builder
public class WebhookLoggingContext {
    private String eventId;
    private String eventType;
    private UUID boxId;
    private String providerSubscriptionId;
    private Integer attempt;

    /**
     * Set MDC context for structured logging.
     */
    public void setMDC() {
        if (eventId != null) MDC.put("billing_event_id", eventId);
        if (eventType != null) MDC.put("billing_event_type", eventType);
        if (boxId != null) MDC.put("box_id", boxId.toString());
        if (providerSubscriptionId != null) MDC.put("provider_subscription_id", providerSubscriptionId);
        if (attempt != null) MDC.put("billing_attempt", attempt.toString());
    }

    /**
     * Clear MDC context.
     */
    public static void clearMDC() {
        MDC.remove("billing_event_id");
        MDC.remove("billing_event_type");
        MDC.remove("box_id");
        MDC.remove("provider_subscription_id");
        MDC.remove("billing_attempt");
    }

    public void logInfo(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.info(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logWarn(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.warn(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logError(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.error(message, args);
        } finally {
            clearMDC();
        }
    }
}
