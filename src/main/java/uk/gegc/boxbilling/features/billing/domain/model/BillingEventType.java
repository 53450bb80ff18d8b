package uk.gegc.boxbilling.features.billing.domain.model;

import java.util.Arrays;

/**
 * Provider event kinds the engine consumes. Anything else maps to {@link #UNKNOWN} and is acknowledged
 * without side effects.
 */
public enum BillingEventType {
    SUBSCRIPTION_CREATED("subscription.created"),
    SUBSCRIPTION_UPDATED("subscription.updated"),
    SUBSCRIPTION_CANCELED("subscription.canceled"),
    SUBSCRIPTION_REVOKED("subscription.revoked"),
    INVOICE_PAID("invoice.paid"),
    INVOICE_PAYMENT_FAILED("invoice.payment_failed"),
    CUSTOMER_UPDATED("customer.updated"),
    CHECKOUT_SESSION_COMPLETED("checkout.session.completed"),
    UNKNOWN("unknown");

    private final String wireName;

    BillingEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static BillingEventType fromWireName(String type) {
        return Arrays.stream(values())
                .filter(t -> t != UNKNOWN && t.wireName.equals(type))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
