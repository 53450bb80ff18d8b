package uk.gegc.boxbilling.features.subscription.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * A priced tier. Plans are versioned; only one version per tier is current.
 */
@Entity
@Table(name = "subscription_plans",
        uniqueConstraints = @UniqueConstraint(name = "uk_subscription_plans_tier_version", columnNames = {"tier", "version"}))
@Getter
@Setter
public class SubscriptionPlan {

    public static final int DEFAULT_OVERAGE_PRICE = 100;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "tier", nullable = false, length = 16)
    private SubscriptionTier tier;

    @Column(name = "version", nullable = false)
    private int version = 1;

    @Column(name = "is_current_version", nullable = false)
    private boolean currentVersion = true;

    @Column(name = "athlete_limit", nullable = false)
    private int athleteLimit;

    @Column(name = "coach_limit", nullable = false)
    private int coachLimit;

    @Column(name = "monthly_price", nullable = false)
    private long monthlyPrice;

    @Column(name = "annual_price", nullable = false)
    private long annualPrice;

    @Column(name = "athlete_overage_price")
    private Integer athleteOveragePrice = DEFAULT_OVERAGE_PRICE;

    @Column(name = "coach_overage_price")
    private Integer coachOveragePrice = DEFAULT_OVERAGE_PRICE;

    @Column(name = "trial_days", nullable = false)
    private int trialDays = 14;

    @Column(name = "provider_product_id")
    private String providerProductId;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
