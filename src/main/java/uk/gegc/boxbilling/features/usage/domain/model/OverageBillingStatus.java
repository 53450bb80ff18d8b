package uk.gegc.boxbilling.features.usage.domain.model;

public enum OverageBillingStatus {
    CALCULATED,
    INVOICED,
    PAID,
    FAILED,
    WAIVED
}
