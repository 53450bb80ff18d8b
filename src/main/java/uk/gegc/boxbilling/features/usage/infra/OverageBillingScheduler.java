package uk.gegc.boxbilling.features.usage.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.boxbilling.features.usage.application.OverageBillingService;
import uk.gegc.boxbilling.features.usage.application.OverageRunSummary;
import uk.gegc.boxbilling.shared.config.FeatureFlags;

/**
 * Monthly overage run, by default at 02:00 on the 1st.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "billing.overage.enabled", havingValue = "true", matchIfMissing = true)
public class OverageBillingScheduler {

    private final OverageBillingService overageBillingService;
    private final FeatureFlags featureFlags;

    @Scheduled(cron = "${billing.overage.cron:0 0 2 1 * *}")
    public void runOverageBilling() {
        if (!featureFlags.isBilling() || !featureFlags.isOverageBilling()) {
            return;
        }
        try {
            OverageRunSummary summary = overageBillingService.processPeriodOverageBilling();
            log.info("OverageBillingScheduler: {}", summary);
        } catch (Exception e) {
            log.error("OverageBillingScheduler: overage run aborted", e);
        }
    }
}
