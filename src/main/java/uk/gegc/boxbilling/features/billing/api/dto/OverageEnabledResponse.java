package uk.gegc.boxbilling.features.billing.api.dto;

import java.util.UUID;

public record OverageEnabledResponse(UUID boxId, boolean overageEnabled, int gracePeriodsResolved) {
}
