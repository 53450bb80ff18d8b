package uk.gegc.boxbilling.features.graceperiod.application;

import uk.gegc.boxbilling.features.graceperiod.domain.model.GracePeriodSeverity;

import java.util.Map;

/**
 * Overrides for a new grace period. Null fields fall back to the reason's defaults.
 */
public record GracePeriodOptions(
        GracePeriodSeverity severity,
        Boolean autoResolve,
        Map<String, Object> contextSnapshot
) {
    public static GracePeriodOptions defaults() {
        return new GracePeriodOptions(null, null, null);
    }

    public static GracePeriodOptions withContext(Map<String, Object> contextSnapshot) {
        return new GracePeriodOptions(null, null, contextSnapshot);
    }
}
