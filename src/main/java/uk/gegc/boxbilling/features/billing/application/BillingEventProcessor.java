package uk.gegc.boxbilling.features.billing.application;

import uk.gegc.boxbilling.features.billing.application.event.NormalizedBillingEvent;

/**
 * Idempotent entry point for provider webhook events.
 */
public interface BillingEventProcessor {

    /**
     * Store the event, apply its effects once and record the outcome. Handler failures are
     * returned as {@link ProcessingResult.Status#FAILED} and scheduled for retry, never thrown.
     *
     * @throws uk.gegc.boxbilling.shared.exception.ValidationException if the envelope is malformed
     */
    ProcessingResult processEvent(NormalizedBillingEvent event);

    /**
     * Re-run failed events whose retry time has come.
     */
    RetryDrainSummary retryFailedEvents();
}
