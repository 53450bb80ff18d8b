package uk.gegc.boxbilling.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

import java.time.Instant;

@Schema(name = "CreatePlanChangeRequest")
public record CreatePlanChangeRequest(
        @Schema(description = "Target tier", example = "scale")
        @NotBlank(message = "toTier is required")
        String toTier,

        @Schema(description = "immediate, next_billing_cycle or end_of_period", defaultValue = "immediate")
        String prorationType,

        @Schema(description = "When the owner wants the change to apply; now when omitted")
        Instant effectiveDate,

        @NotBlank(message = "requestedBy is required")
        String requestedBy
) {
}
