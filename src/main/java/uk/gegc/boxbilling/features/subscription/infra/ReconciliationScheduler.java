package uk.gegc.boxbilling.features.subscription.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.boxbilling.features.subscription.application.EnforcementSummary;
import uk.gegc.boxbilling.features.subscription.application.SubscriptionEnforcementService;
import uk.gegc.boxbilling.shared.config.FeatureFlags;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "billing.reconciliation.enabled", havingValue = "true", matchIfMissing = true)
public class ReconciliationScheduler {

    private final SubscriptionEnforcementService enforcementService;
    private final FeatureFlags featureFlags;

    @Scheduled(cron = "${billing.reconciliation.cron:0 0 3 * * *}")
    public void reconcile() {
        if (!featureFlags.isBilling()) {
            return;
        }
        try {
            EnforcementSummary summary = enforcementService.enforceSubscriptionRules();
            if (summary.failures() > 0) {
                log.warn("ReconciliationScheduler: {} box(es) could not be corrected", summary.failures());
            }
        } catch (Exception e) {
            log.error("ReconciliationScheduler: sweep aborted", e);
        }
    }
}
