package uk.gegc.boxbilling.features.usage.application;

import uk.gegc.boxbilling.features.box.domain.model.Box;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionPlan;
import uk.gegc.boxbilling.features.usage.domain.model.UsageEventType;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Usage accounting against plan limits.
 */
public interface UsageTrackingService {

    SubscriptionUsage calculateUsage(UUID boxId);

    /**
     * Limits resolve plan first, then the box's own limits, then the platform defaults.
     *
     * @param plan may be {@code null}
     * @param box  may be {@code null}, in which case it is loaded
     */
    SubscriptionUsage calculateUsage(UUID boxId, SubscriptionPlan plan, Box box);

    UsageTrackingResult trackEvents(UUID boxId, List<UsageEventRequest> events);

    Box updateBoxUsageCounts(UUID boxId);

    /**
     * Called by the membership mutation path after adding or removing members. When a limit is crossed
     * and the box does not bill overage, a limit-exceeded grace period is opened.
     */
    LimitCheckResult checkLimitsAndTriggerActions(UUID boxId, Collection<UsageEventType> changes);
}
