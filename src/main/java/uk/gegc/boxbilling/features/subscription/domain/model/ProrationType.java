package uk.gegc.boxbilling.features.subscription.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * When the price difference of a plan change is charged. Only {@link #IMMEDIATE} prorates; the other
 * two settle on the next regular invoice.
 */
public enum ProrationType {
    IMMEDIATE("immediate"),
    NEXT_BILLING_CYCLE("next_billing_cycle"),
    END_OF_PERIOD("end_of_period");

    private final String value;

    ProrationType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<ProrationType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(t -> t.value.equals(normalized))
                .findFirst();
    }
}
