package uk.gegc.boxbilling.features.billing.application.event;

import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionTier;

public record CheckoutSnapshot(
        String providerCheckoutId,
        String providerCustomerId,
        String providerSubscriptionId,
        SubscriptionTier tier
) {
}
