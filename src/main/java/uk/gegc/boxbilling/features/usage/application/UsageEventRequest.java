package uk.gegc.boxbilling.features.usage.application;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import uk.gegc.boxbilling.features.usage.domain.model.UsageEventType;

import java.util.Map;
import java.util.UUID;

public record UsageEventRequest(
        @NotNull UsageEventType eventType,
        @Positive int quantity,
        UUID entityId,
        UUID userId,
        boolean billable,
        Map<String, Object> metadata
) {
    public static UsageEventRequest of(UsageEventType eventType) {
        return new UsageEventRequest(eventType, 1, null, null, false, null);
    }
}
