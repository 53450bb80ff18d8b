package uk.gegc.boxbilling.features.subscription.application;

import uk.gegc.boxbilling.features.billing.application.event.InvoiceSnapshot;
import uk.gegc.boxbilling.features.billing.application.event.SubscriptionSnapshot;
import uk.gegc.boxbilling.features.subscription.domain.model.Subscription;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionChange;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionPlan;

import java.util.List;
import java.util.UUID;

/**
 * Event-driven and owner-initiated transitions of a box's subscription.
 *
 * <p>Every handler upserts by provider subscription id, so replaying an event leaves the same end state.
 * Events for one subscription are applied last-write-wins.</p>
 */
public interface SubscriptionLifecycleService {

    /**
     * subscription.created: the subscription becomes active (or trialing) and the box active.
     */
    Subscription handleSubscriptionCreated(UUID boxId, SubscriptionSnapshot snapshot);

    /**
     * subscription.updated: fields as provided. Box limits change only with the tier,
     * box status only with the subscription status.
     */
    Subscription handleSubscriptionUpdated(UUID boxId, SubscriptionSnapshot snapshot);

    /**
     * subscription.canceled: scheduled when {@code cancelAtPeriodEnd}, otherwise immediate with a
     * suspended box and a blocking grace period.
     */
    Subscription handleSubscriptionCanceled(UUID boxId, SubscriptionSnapshot snapshot);

    /**
     * subscription.revoked: canceled and suspended immediately.
     */
    Subscription handleSubscriptionRevoked(UUID boxId, SubscriptionSnapshot snapshot);

    /**
     * invoice.payment_failed: past_due, box payment_failed, critical grace period.
     */
    Subscription handlePaymentFailed(UUID boxId, InvoiceSnapshot invoice);

    Subscription cancelSubscription(UUID boxId, boolean cancelAtPeriodEnd, String reason, String userId);

    /**
     * Undo a cancellation while the paid period is still running.
     *
     * @throws IllegalStateException if the subscription is not canceled or its period has ended
     */
    Subscription reactivateSubscription(UUID boxId, String userId);

    /**
     * Move the box's current subscription onto {@code toPlan}; the box tier and limits follow.
     *
     * @throws IllegalStateException if the subscription is canceled
     */
    Subscription applyPlanChange(UUID boxId, SubscriptionPlan toPlan, String reason, String userId);

    /**
     * Most recent transitions first.
     */
    List<SubscriptionChange> getSubscriptionHistory(UUID boxId, int limit);
}
