package uk.gegc.boxbilling.features.billing.application.impl;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.boxbilling.features.billing.application.BillingNotificationService;
import uk.gegc.boxbilling.features.graceperiod.domain.model.GracePeriod;
import uk.gegc.boxbilling.features.usage.domain.model.OverageBillingRecord;

/**
 * Logs notifications instead of sending them.
 *
 * Activated when: billing.notifications.provider=noop (default)
 */
@Slf4j
public class NoopBillingNotificationService implements BillingNotificationService {

    public NoopBillingNotificationService() {
        log.info("NoopBillingNotificationService initialized - billing notifications will be logged but not sent");
    }

    @Override
    public void gracePeriodStarted(GracePeriod gracePeriod) {
        log.info("[NOOP] Would notify box {} of grace period {} ({}) ending at {}",
                gracePeriod.getBoxId(), gracePeriod.getId(), gracePeriod.getReason().getValue(), gracePeriod.getEndsAt());
    }

    @Override
    public void gracePeriodResolved(GracePeriod gracePeriod) {
        log.info("[NOOP] Would notify box {} that grace period {} was resolved: {}",
                gracePeriod.getBoxId(), gracePeriod.getId(), gracePeriod.getResolution());
    }

    @Override
    public void gracePeriodExpiring(GracePeriod gracePeriod) {
        log.info("[NOOP] Would remind box {} that grace period {} ({}) expires at {}",
                gracePeriod.getBoxId(), gracePeriod.getId(), gracePeriod.getReason().getValue(), gracePeriod.getEndsAt());
    }

    @Override
    public void overageCalculated(OverageBillingRecord record) {
        log.info("[NOOP] Would notify box {} of overage charge {} for period {} - {}",
                record.getBoxId(), record.getTotalOverageAmount(), record.getBillingPeriodStart(), record.getBillingPeriodEnd());
    }
}
