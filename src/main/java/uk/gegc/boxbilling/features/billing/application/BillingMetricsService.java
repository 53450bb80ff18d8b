package uk.gegc.boxbilling.features.billing.application;

import java.time.Duration;

/**
 * Counters and timers for the billing engine.
 */
public interface BillingMetricsService {

    void incrementWebhookReceived(String eventType);

    void incrementWebhookProcessed(String eventType);

    void incrementWebhookDuplicate(String eventType);

    void incrementWebhookIgnored(String eventType);

    void incrementWebhookFailed(String eventType);

    /**
     * Event exhausted its retries and needs an operator.
     */
    void incrementWebhookTerminalFailure(String eventType);

    void recordWebhookLatency(String eventType, Duration latency);

    void incrementGracePeriodTriggered(String reason);

    void incrementGracePeriodResolved(String reason);

    void incrementOverageRecordCreated();

    void incrementReconciliationCorrection(String kind);

    void incrementAccessDenied(String reason);
}
