package uk.gegc.boxbilling.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "CancelPlanChangeRequest")
public record CancelPlanChangeRequest(
        @Size(max = 255, message = "Reason must not exceed 255 characters")
        String reason,

        @NotBlank(message = "requestedBy is required")
        String requestedBy
) {
}
