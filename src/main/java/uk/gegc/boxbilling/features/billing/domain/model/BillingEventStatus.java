package uk.gegc.boxbilling.features.billing.domain.model;

public enum BillingEventStatus {
    PENDING,
    PROCESSING,
    PROCESSED,
    FAILED
}
