package uk.gegc.boxbilling.features.subscription.application;

import uk.gegc.boxbilling.features.subscription.domain.model.PlanChangeRequest;
import uk.gegc.boxbilling.features.subscription.domain.model.ProrationType;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionTier;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Owner-requested upgrades and downgrades. A request is recorded as pending; approval applies the new
 * plan to the subscription and the box limits.
 */
public interface PlanChangeService {

    /**
     * @param prorationType {@code null} means {@link ProrationType#IMMEDIATE}
     * @param effectiveDate {@code null} means now
     * @throws IllegalStateException if the box has no active subscription, is already on the tier,
     *                               or already has a pending request
     */
    PlanChangeRequest requestPlanChange(UUID boxId, SubscriptionTier toTier, ProrationType prorationType,
                                        Instant effectiveDate, String requestedBy);

    /**
     * Apply a pending request. The prorated amount is stored on the request.
     *
     * @throws IllegalStateException if the request is not pending
     */
    PlanChangeRequest approvePlanChange(UUID requestId, String approvedBy);

    PlanChangeRequest cancelPlanChange(UUID requestId, String canceledBy, String reason);

    List<PlanChangeRequest> getPendingPlanChanges(UUID boxId);
}
