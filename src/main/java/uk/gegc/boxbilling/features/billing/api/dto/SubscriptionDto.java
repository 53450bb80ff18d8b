package uk.gegc.boxbilling.features.billing.api.dto;

import uk.gegc.boxbilling.features.subscription.domain.model.Subscription;

import java.time.Instant;
import java.util.UUID;

public record SubscriptionDto(
        UUID id,
        UUID boxId,
        String providerSubscriptionId,
        String status,
        String tier,
        Instant currentPeriodStart,
        Instant currentPeriodEnd,
        boolean cancelAtPeriodEnd,
        Instant canceledAt,
        String cancelReason
) {
    public static SubscriptionDto from(Subscription subscription) {
        return new SubscriptionDto(
                subscription.getId(),
                subscription.getBoxId(),
                subscription.getProviderSubscriptionId(),
                subscription.getStatus().getValue(),
                subscription.getPlanTier().getValue(),
                subscription.getCurrentPeriodStart(),
                subscription.getCurrentPeriodEnd(),
                subscription.isCancelAtPeriodEnd(),
                subscription.getCanceledAt(),
                subscription.getCancelReason()
        );
    }
}
