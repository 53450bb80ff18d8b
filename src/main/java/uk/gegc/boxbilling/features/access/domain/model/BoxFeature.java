package uk.gegc.boxbilling.features.access.domain.model;

import java.util.Arrays;
import java.util.Optional;

public enum BoxFeature {
    ADD_ATHLETE("add_athlete"),
    ADD_COACH("add_coach"),
    ADVANCED_ANALYTICS("advanced_analytics"),
    API_ACCESS("api_access");

    private final String value;

    BoxFeature(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<BoxFeature> fromValue(String value) {
        return Arrays.stream(values())
                .filter(feature -> feature.value.equalsIgnoreCase(value))
                .findFirst();
    }
}
