package uk.gegc.boxbilling.features.usage.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Overage charge for one billing period. One row per box and period.
 */
@Entity
@Table(name = "overage_billing",
        uniqueConstraints = @UniqueConstraint(name = "uk_overage_billing_period",
                columnNames = {"box_id", "billing_period_start", "billing_period_end"}))
@Getter
@Setter
public class OverageBillingRecord {

    public static final String END_OF_PERIOD = "end_of_period";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "box_id", nullable = false, updatable = false)
    private UUID boxId;

    @Column(name = "subscription_id", nullable = false, updatable = false)
    private UUID subscriptionId;

    @Column(name = "billing_period_start", nullable = false, updatable = false)
    private Instant billingPeriodStart;

    @Column(name = "billing_period_end", nullable = false, updatable = false)
    private Instant billingPeriodEnd;

    @Column(name = "athlete_limit", nullable = false)
    private int athleteLimit;

    @Column(name = "coach_limit", nullable = false)
    private int coachLimit;

    @Column(name = "athlete_count", nullable = false)
    private int athleteCount;

    @Column(name = "coach_count", nullable = false)
    private int coachCount;

    @Column(name = "athlete_overage", nullable = false)
    private int athleteOverage;

    @Column(name = "coach_overage", nullable = false)
    private int coachOverage;

    @Column(name = "athlete_overage_rate", nullable = false)
    private int athleteOverageRate;

    @Column(name = "coach_overage_rate", nullable = false)
    private int coachOverageRate;

    @Column(name = "athlete_overage_amount", nullable = false)
    private long athleteOverageAmount;

    @Column(name = "coach_overage_amount", nullable = false)
    private long coachOverageAmount;

    @Column(name = "total_overage_amount", nullable = false)
    private long totalOverageAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private OverageBillingStatus status = OverageBillingStatus.CALCULATED;

    @Column(name = "provider_invoice_id")
    private String providerInvoiceId;

    @Column(name = "calculation_method", nullable = false, length = 32)
    private String calculationMethod = END_OF_PERIOD;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
