package uk.gegc.boxbilling.features.graceperiod.domain.model;

/**
 * Resolution labels written by the engine itself. Manual resolutions carry free text.
 */
public final class GracePeriodResolution {

    public static final String EXPIRED = "expired";
    public static final String PAYMENT_RECEIVED = "payment_received";
    public static final String SUBSCRIPTION_REACTIVATED = "subscription_reactivated";
    public static final String OVERAGE_ENABLED = "overage_enabled";

    public static final String SYSTEM_ACTOR = "system";

    private GracePeriodResolution() {
    }
}
