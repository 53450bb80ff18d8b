package uk.gegc.boxbilling.features.subscription.domain.model;

public enum PlanChangeStatus {
    PENDING,
    APPROVED,
    CANCELED
}
