package uk.gegc.boxbilling.features.usage.domain.model;

import java.util.EnumSet;
import java.util.Set;

public enum UsageEventType {
    ATHLETE_ADDED,
    ATHLETE_REMOVED,
    COACH_ADDED,
    COACH_REMOVED,
    CHECKIN_LOGGED,
    PR_LOGGED,
    WOD_COMPLETED,
    SUBSCRIPTION_CREATED,
    SUBSCRIPTION_UPDATED,
    SUBSCRIPTION_CANCELED,
    SUBSCRIPTION_REVOKED,
    SUBSCRIPTION_REACTIVATED,
    PLAN_CHANGED,
    PAYMENT_FAILED,
    INVOICE_PAID,
    GRACE_PERIOD_TRIGGERED,
    GRACE_PERIOD_RESOLVED,
    OVERAGE_CALCULATED,
    OVERAGE_ENABLED,
    TRIAL_EXPIRED;

    public static final Set<UsageEventType> MEMBERSHIP_CHANGES =
            EnumSet.of(ATHLETE_ADDED, ATHLETE_REMOVED, COACH_ADDED, COACH_REMOVED);

    public boolean isMembershipChange() {
        return MEMBERSHIP_CHANGES.contains(this);
    }
}
