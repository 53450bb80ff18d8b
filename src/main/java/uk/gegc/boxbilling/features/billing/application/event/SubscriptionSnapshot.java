package uk.gegc.boxbilling.features.billing.application.event;

import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionStatus;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionTier;

import java.time.Instant;

/**
 * Subscription fields carried by a {@code subscription.*} event. Anything the provider omitted is null.
 *
 * @param endsAt date the cancellation takes effect, when the provider sends one
 */
public record SubscriptionSnapshot(
        String providerSubscriptionId,
        String providerCustomerId,
        SubscriptionStatus status,
        SubscriptionTier tier,
        String productId,
        Instant currentPeriodStart,
        Instant currentPeriodEnd,
        boolean cancelAtPeriodEnd,
        Instant canceledAt,
        Instant endsAt,
        String cancelReason,
        String currency,
        Long amount,
        String interval
) {
}
