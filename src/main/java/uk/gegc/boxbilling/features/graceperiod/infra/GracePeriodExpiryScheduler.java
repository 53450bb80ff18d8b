package uk.gegc.boxbilling.features.graceperiod.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.boxbilling.features.billing.application.BillingNotificationService;
import uk.gegc.boxbilling.features.graceperiod.application.GracePeriodService;
import uk.gegc.boxbilling.features.graceperiod.domain.model.GracePeriod;
import uk.gegc.boxbilling.shared.config.FeatureFlags;

import java.util.List;

/**
 * Warns owners about grace periods ending within the next day.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GracePeriodExpiryScheduler {

    private final GracePeriodService gracePeriodService;
    private final BillingNotificationService notificationService;
    private final FeatureFlags featureFlags;

    @Scheduled(cron = "${billing.grace-periods.expiry-check-cron:0 0 1 * * *}")
    public void notifyExpiring() {
        if (!featureFlags.isBilling()) {
            return;
        }
        List<GracePeriod> expiring;
        try {
            expiring = gracePeriodService.getUpcomingExpirations(1);
        } catch (Exception e) {
            log.warn("GracePeriodExpiryScheduler: could not load expiring grace periods", e);
            return;
        }
        for (GracePeriod gracePeriod : expiring) {
            log.info("Grace period {} ({}) for box {} ends at {}",
                    gracePeriod.getId(), gracePeriod.getReason().getValue(), gracePeriod.getBoxId(), gracePeriod.getEndsAt());
            try {
                notificationService.gracePeriodExpiring(gracePeriod);
            } catch (Exception e) {
                log.warn("GracePeriodExpiryScheduler: notification for grace period {} failed", gracePeriod.getId(), e);
            }
        }
    }
}
