package uk.gegc.boxbilling.features.subscription.domain.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Subscription status as reported by the billing provider, plus {@link #TRIAL} which is only
 * used on a box that is trialing without a provider subscription.
 */
public enum SubscriptionStatus {
    TRIAL("trial"),
    TRIALING("trialing"),
    ACTIVE("active"),
    PAST_DUE("past_due"),
    CANCELED("canceled"),
    UNPAID("unpaid"),
    INCOMPLETE("incomplete"),
    INCOMPLETE_EXPIRED("incomplete_expired"),
    REVOKED("revoked"),
    PAUSED("paused");

    private static final Set<SubscriptionStatus> ACCESS_GRANTING = EnumSet.of(ACTIVE, TRIALING, PAST_DUE);
    private static final Set<SubscriptionStatus> TERMINAL = EnumSet.of(CANCELED, REVOKED, UNPAID, INCOMPLETE_EXPIRED);

    private final String value;

    SubscriptionStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Active, trialing and past_due keep the box usable while the period runs.
     */
    public boolean grantsAccess() {
        return ACCESS_GRANTING.contains(this);
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean isActiveLike() {
        return this == ACTIVE || this == TRIALING;
    }

    public static Optional<SubscriptionStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(s -> s.value.equals(normalized))
                .findFirst();
    }
}
