package uk.gegc.boxbilling.features.billing.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.boxbilling.features.billing.application.BillingEventProcessor;
import uk.gegc.boxbilling.shared.config.FeatureFlags;

/**
 * Drains failed webhook events whose backoff has elapsed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BillingEventRetryScheduler {

    private final BillingEventProcessor billingEventProcessor;
    private final FeatureFlags featureFlags;

    @Scheduled(fixedDelayString = "${billing.webhook.retry-drain-delay-ms:60000}")
    public void drainRetries() {
        if (!featureFlags.isBilling()) {
            return;
        }
        try {
            billingEventProcessor.retryFailedEvents();
        } catch (Exception e) {
            log.warn("BillingEventRetryScheduler: error while draining failed events", e);
        }
    }
}
