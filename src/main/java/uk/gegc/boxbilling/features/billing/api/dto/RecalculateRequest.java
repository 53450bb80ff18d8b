package uk.gegc.boxbilling.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

@Schema(name = "RecalculateRequest", description = "Maintenance tasks to run for one box")
public record RecalculateRequest(
        @Schema(description = "Task names: daily, risk_scores", example = "[\"daily\"]")
        @NotEmpty(message = "At least one task is required")
        List<String> tasks
) {
}
