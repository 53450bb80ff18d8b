package uk.gegc.boxbilling.features.usage.application;

public record OverageCalculation(
        int athleteLimit,
        int coachLimit,
        int athleteCount,
        int coachCount,
        int athleteOverage,
        int coachOverage,
        int athleteOverageRate,
        int coachOverageRate,
        long athleteOverageAmount,
        long coachOverageAmount,
        long totalOverageAmount
) {
    public static OverageCalculation from(SubscriptionUsage usage) {
        long athleteAmount = (long) usage.athleteOverage() * usage.athleteOverageRate();
        long coachAmount = (long) usage.coachOverage() * usage.coachOverageRate();
        return new OverageCalculation(
                usage.athleteLimit(),
                usage.coachLimit(),
                usage.athletes(),
                usage.coaches(),
                usage.athleteOverage(),
                usage.coachOverage(),
                usage.athleteOverageRate(),
                usage.coachOverageRate(),
                athleteAmount,
                coachAmount,
                athleteAmount + coachAmount
        );
    }
}
