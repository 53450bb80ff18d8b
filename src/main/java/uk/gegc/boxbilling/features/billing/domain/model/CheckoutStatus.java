package uk.gegc.boxbilling.features.billing.domain.model;

public enum CheckoutStatus {
    OPEN,
    COMPLETED
}
