package uk.gegc.boxbilling.features.subscription.domain.model;

/**
 * Upgrade or downgrade, judged by the monthly list price of the two plans.
 */
public enum PlanChangeDirection {
    UPGRADE,
    DOWNGRADE,
    LATERAL;

    public static PlanChangeDirection between(long fromMonthlyPrice, long toMonthlyPrice) {
        if (toMonthlyPrice > fromMonthlyPrice) {
            return UPGRADE;
        }
        return toMonthlyPrice < fromMonthlyPrice ? DOWNGRADE : LATERAL;
    }
}
