package uk.gegc.boxbilling.features.box.domain.model;

/**
 * Box-level access status. A derived projection of subscription and grace-period state,
 * written only through {@code BoxStatusTransitions}.
 */
public enum BoxStatus {
    ACTIVE("active"),
    SUSPENDED("suspended"),
    TRIAL_EXPIRED("trial_expired"),
    PAYMENT_FAILED("payment_failed");

    private final String value;

    BoxStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
