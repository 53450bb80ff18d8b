package uk.gegc.boxbilling.features.subscription.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * An owner's request to move the box to another plan. Stays pending until an operator approves or
 * cancels it.
 */
@Entity
@Table(name = "plan_change_requests")
@Getter
@Setter
public class PlanChangeRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "box_id", nullable = false)
    private UUID boxId;

    @Column(name = "subscription_id", nullable = false)
    private UUID subscriptionId;

    @Column(name = "from_plan_id", nullable = false)
    private UUID fromPlanId;

    @Column(name = "to_plan_id", nullable = false)
    private UUID toPlanId;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_tier", nullable = false, length = 16)
    private SubscriptionTier fromTier;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_tier", nullable = false, length = 16)
    private SubscriptionTier toTier;

    @Enumerated(EnumType.STRING)
    @Column(name = "direction", nullable = false, length = 16)
    private PlanChangeDirection direction;

    @Enumerated(EnumType.STRING)
    @Column(name = "proration_type", nullable = false, length = 32)
    private ProrationType prorationType = ProrationType.IMMEDIATE;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private PlanChangeStatus status = PlanChangeStatus.PENDING;

    @Column(name = "requested_effective_date")
    private Instant requestedEffectiveDate;

    @Column(name = "requested_by", nullable = false, length = 64)
    private String requestedBy;

    @Column(name = "approved_by", length = 64)
    private String approvedBy;

    @Column(name = "approved_at")
    private Instant approvedAt;

    /**
     * Minor units; negative when the box is owed money.
     */
    @Column(name = "prorated_amount")
    private Long proratedAmount;

    @Column(name = "canceled_by", length = 64)
    private String canceledBy;

    @Column(name = "cancel_reason")
    private String cancelReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean isPending() {
        return status == PlanChangeStatus.PENDING;
    }
}
