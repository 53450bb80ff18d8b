package uk.gegc.boxbilling.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "CancelSubscriptionRequest")
public record CancelSubscriptionRequest(
        @Schema(description = "Cancel when the current period ends instead of now", defaultValue = "true")
        Boolean cancelAtPeriodEnd,

        @Size(max = 255, message = "Reason must not exceed 255 characters")
        String reason,

        @Schema(description = "User performing the cancellation")
        @NotBlank(message = "requestedBy is required")
        String requestedBy
) {
    public boolean atPeriodEnd() {
        return cancelAtPeriodEnd == null || cancelAtPeriodEnd;
    }
}
