package uk.gegc.boxbilling.features.billing.application;

import uk.gegc.boxbilling.features.graceperiod.domain.model.GracePeriod;
import uk.gegc.boxbilling.features.usage.domain.model.OverageBillingRecord;

/**
 * Outbound notifications about billing state. Formatting and delivery belong to the notification
 * feature; callers treat failures here as non-fatal.
 */
public interface BillingNotificationService {

    void gracePeriodStarted(GracePeriod gracePeriod);

    void gracePeriodResolved(GracePeriod gracePeriod);

    void gracePeriodExpiring(GracePeriod gracePeriod);

    void overageCalculated(OverageBillingRecord record);
}
