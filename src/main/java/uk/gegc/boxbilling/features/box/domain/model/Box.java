package uk.gegc.boxbilling.features.box.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionStatus;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionTier;

import java.time.Instant;
import java.util.UUID;

/**
 * A tenant gym. Carries the denormalised subscription projection read by the access check.
 */
@Entity
@Table(name = "boxes")
@Getter
@Setter
public class Box {

    public static final int DEFAULT_ATHLETE_LIMIT = 75;
    public static final int DEFAULT_COACH_LIMIT = 3;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "name", nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private BoxStatus status = BoxStatus.ACTIVE;

    @Enumerated(EnumType.STRING)
    @Column(name = "subscription_status", nullable = false, length = 32)
    private SubscriptionStatus subscriptionStatus = SubscriptionStatus.TRIAL;

    @Enumerated(EnumType.STRING)
    @Column(name = "subscription_tier", nullable = false, length = 16)
    private SubscriptionTier subscriptionTier = SubscriptionTier.SEED;

    @Column(name = "provider_subscription_id", unique = true)
    private String providerSubscriptionId;

    @Column(name = "provider_customer_id")
    private String providerCustomerId;

    @Column(name = "trial_ends_at")
    private Instant trialEndsAt;

    @Column(name = "subscription_starts_at")
    private Instant subscriptionStartsAt;

    @Column(name = "subscription_ends_at")
    private Instant subscriptionEndsAt;

    @Column(name = "next_billing_date")
    private Instant nextBillingDate;

    @Column(name = "is_overage_enabled", nullable = false)
    private boolean overageEnabled = false;

    @Column(name = "current_athlete_count", nullable = false)
    private int currentAthleteCount = 0;

    @Column(name = "current_coach_count", nullable = false)
    private int currentCoachCount = 0;

    @Column(name = "current_athlete_limit", nullable = false)
    private int currentAthleteLimit = DEFAULT_ATHLETE_LIMIT;

    @Column(name = "current_coach_limit", nullable = false)
    private int currentCoachLimit = DEFAULT_COACH_LIMIT;

    @Version
    @Column(name = "version")
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
