package uk.gegc.boxbilling.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "ActorRequest", description = "Identifies the user performing an admin action")
public record ActorRequest(
        @NotBlank(message = "requestedBy is required")
        String requestedBy
) {
}
