package uk.gegc.boxbilling.features.billing.api.dto;

import uk.gegc.boxbilling.features.graceperiod.domain.model.GracePeriod;

import java.time.Instant;
import java.util.UUID;

public record GracePeriodDto(
        UUID id,
        UUID boxId,
        String reason,
        String severity,
        Instant endsAt,
        boolean autoResolve,
        boolean resolved,
        Instant resolvedAt,
        String resolution,
        String resolvedBy,
        Instant createdAt
) {
    public static GracePeriodDto from(GracePeriod gracePeriod) {
        return new GracePeriodDto(
                gracePeriod.getId(),
                gracePeriod.getBoxId(),
                gracePeriod.getReason().getValue(),
                gracePeriod.getSeverity().name().toLowerCase(),
                gracePeriod.getEndsAt(),
                gracePeriod.isAutoResolve(),
                gracePeriod.isResolved(),
                gracePeriod.getResolvedAt(),
                gracePeriod.getResolution(),
                gracePeriod.getResolvedBy(),
                gracePeriod.getCreatedAt()
        );
    }
}
