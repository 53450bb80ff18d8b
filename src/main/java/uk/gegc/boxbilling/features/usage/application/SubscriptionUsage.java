package uk.gegc.boxbilling.features.usage.application;

import java.time.Instant;

/**
 * Current membership counts measured against plan limits.
 */
public record SubscriptionUsage(
        int athletes,
        int coaches,
        int athleteLimit,
        int coachLimit,
        int athletesPercentage,
        int coachesPercentage,
        boolean isAthleteOverLimit,
        boolean isCoachOverLimit,
        int athleteOverage,
        int coachOverage,
        int athleteOverageRate,
        int coachOverageRate,
        boolean hasOverageEnabled,
        Instant nextBillingDate,
        long estimatedOverageAmount
) {
    public boolean hasOverage() {
        return athleteOverage > 0 || coachOverage > 0;
    }
}
