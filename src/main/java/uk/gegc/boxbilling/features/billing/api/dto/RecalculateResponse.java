package uk.gegc.boxbilling.features.billing.api.dto;

import java.util.List;
import java.util.UUID;

public record RecalculateResponse(UUID boxId, boolean success, List<TaskResult> results) {
}
