package uk.gegc.boxbilling.features.subscription.domain.model;

import java.util.Arrays;
import java.util.Optional;

public enum SubscriptionTier {
    SEED("seed"),
    GROW("grow"),
    SCALE("scale");

    private final String value;

    SubscriptionTier(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<SubscriptionTier> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(t -> t.value.equals(normalized))
                .findFirst();
    }
}
