package uk.gegc.boxbilling.features.graceperiod.domain.model;

import java.time.Duration;

/**
 * Why a grace period was opened, with its fixed duration and default severity.
 */
public enum GracePeriodReason {
    ATHLETE_LIMIT_EXCEEDED("athlete_limit_exceeded", 14, GracePeriodSeverity.WARNING),
    COACH_LIMIT_EXCEEDED("coach_limit_exceeded", 14, GracePeriodSeverity.WARNING),
    TRIAL_ENDING("trial_ending", 7, GracePeriodSeverity.CRITICAL),
    PAYMENT_FAILED("payment_failed", 3, GracePeriodSeverity.CRITICAL),
    SUBSCRIPTION_CANCELED("subscription_canceled", 0, GracePeriodSeverity.BLOCKING),
    BILLING_ISSUE("billing_issue", 7, GracePeriodSeverity.WARNING);

    private final String value;
    private final int days;
    private final GracePeriodSeverity defaultSeverity;

    GracePeriodReason(String value, int days, GracePeriodSeverity defaultSeverity) {
        this.value = value;
        this.days = days;
        this.defaultSeverity = defaultSeverity;
    }

    public String getValue() {
        return value;
    }

    public int getDays() {
        return days;
    }

    public Duration getDuration() {
        return Duration.ofDays(days);
    }

    public GracePeriodSeverity getDefaultSeverity() {
        return defaultSeverity;
    }
}
