package uk.gegc.boxbilling.features.billing.api.dto;

import uk.gegc.boxbilling.features.subscription.domain.model.PlanChangeRequest;

import java.time.Instant;
import java.util.UUID;

public record PlanChangeDto(
        UUID id,
        UUID boxId,
        String fromTier,
        String toTier,
        String direction,
        String prorationType,
        String status,
        Instant requestedEffectiveDate,
        String requestedBy,
        String approvedBy,
        Instant approvedAt,
        Long proratedAmount,
        String cancelReason,
        Instant createdAt
) {
    public static PlanChangeDto from(PlanChangeRequest request) {
        return new PlanChangeDto(
                request.getId(),
                request.getBoxId(),
                request.getFromTier().getValue(),
                request.getToTier().getValue(),
                request.getDirection().name().toLowerCase(),
                request.getProrationType().getValue(),
                request.getStatus().name().toLowerCase(),
                request.getRequestedEffectiveDate(),
                request.getRequestedBy(),
                request.getApprovedBy(),
                request.getApprovedAt(),
                request.getProratedAmount(),
                request.getCancelReason(),
                request.getCreatedAt()
        );
    }
}
