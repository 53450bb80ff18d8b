package uk.gegc.boxbilling.features.graceperiod.domain.model;

public enum GracePeriodSeverity {
    INFO,
    WARNING,
    CRITICAL,
    BLOCKING
}
