package uk.gegc.boxbilling.features.billing.api.dto;

import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionChange;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionStatus;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionTier;

import java.time.Instant;
import java.util.UUID;

public record SubscriptionChangeDto(
        UUID id,
        UUID subscriptionId,
        String changeType,
        String fromStatus,
        String toStatus,
        String fromTier,
        String toTier,
        String reason,
        String triggeredBy,
        Instant createdAt
) {
    public static SubscriptionChangeDto from(SubscriptionChange change) {
        return new SubscriptionChangeDto(
                change.getId(),
                change.getSubscriptionId(),
                change.getChangeType().name().toLowerCase(),
                status(change.getFromStatus()),
                status(change.getToStatus()),
                tier(change.getFromTier()),
                tier(change.getToTier()),
                change.getReason(),
                change.getTriggeredBy(),
                change.getCreatedAt()
        );
    }

    private static String status(SubscriptionStatus status) {
        return status == null ? null : status.getValue();
    }

    private static String tier(SubscriptionTier tier) {
        return tier == null ? null : tier.getValue();
    }
}
