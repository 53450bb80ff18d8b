package uk.gegc.boxbilling.features.billing.domain.model;

public enum OrderType {
    SUBSCRIPTION,
    OVERAGE
}
