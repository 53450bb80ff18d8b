package uk.gegc.boxbilling.features.usage.application;

import java.time.Instant;

/**
 * Half-open interval {@code [start, end)}.
 */
public record BillingPeriod(Instant start, Instant end) {
}
