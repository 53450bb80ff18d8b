package uk.gegc.boxbilling.features.usage.application;

import uk.gegc.boxbilling.features.graceperiod.application.GracePeriodTriggerResult;

import java.util.List;

/**
 * @param gracePeriods grace periods opened or found open because a limit was crossed; always empty
 *                     when the box bills overage instead
 */
public record LimitCheckResult(
        SubscriptionUsage usage,
        boolean athleteLimitApproaching,
        boolean coachLimitApproaching,
        List<GracePeriodTriggerResult> gracePeriods
) {
}
