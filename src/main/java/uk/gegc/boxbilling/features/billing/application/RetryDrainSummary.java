package uk.gegc.boxbilling.features.billing.application;

public record RetryDrainSummary(int attempted, int succeeded, int failed) {

    public static RetryDrainSummary empty() {
        return new RetryDrainSummary(0, 0, 0);
    }
}
