package uk.gegc.boxbilling.features.subscription.application;

public record EnforcementSummary(int trialsExpired, int boxesSuspended, int failures) {
}
