package uk.gegc.boxbilling.features.usage.application;

public record UsageTrackingResult(int eventsTracked, BillingPeriod billingPeriod, LimitCheckResult limitCheck) {
}
