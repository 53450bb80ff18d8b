package uk.gegc.boxbilling.features.billing.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import uk.gegc.boxbilling.features.usage.application.UsageEventRequest;

import java.util.List;

public record TrackUsageRequest(@NotEmpty List<@Valid UsageEventRequest> events) {
}
