package uk.gegc.boxbilling.features.subscription.domain.model;

public enum SubscriptionChangeType {
    CREATED,
    UPDATED,
    PLAN_CHANGED,
    CANCELLATION_SCHEDULED,
    CANCELED,
    REVOKED,
    PAYMENT_FAILED,
    REACTIVATED,
    SUPERSEDED
}
