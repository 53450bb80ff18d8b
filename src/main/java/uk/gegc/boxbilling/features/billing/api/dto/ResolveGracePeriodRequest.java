package uk.gegc.boxbilling.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "ResolveGracePeriodRequest")
public record ResolveGracePeriodRequest(
        @Schema(description = "How the issue was settled", example = "manual_override")
        @NotBlank(message = "resolution is required")
        @Size(max = 64)
        String resolution,

        @NotBlank(message = "resolvedBy is required")
        String resolvedBy
) {
}
