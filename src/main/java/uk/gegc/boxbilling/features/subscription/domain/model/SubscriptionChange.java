package uk.gegc.boxbilling.features.subscription.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only history of subscription transitions.
 */
@Entity
@Table(name = "subscription_changes")
@Getter
@Setter
public class SubscriptionChange {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "box_id", nullable = false)
    private UUID boxId;

    @Column(name = "subscription_id", nullable = false)
    private UUID subscriptionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "change_type", nullable = false, length = 32)
    private SubscriptionChangeType changeType;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", length = 32)
    private SubscriptionStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", length = 32)
    private SubscriptionStatus toStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_tier", length = 16)
    private SubscriptionTier fromTier;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_tier", length = 16)
    private SubscriptionTier toTier;

    @Column(name = "reason")
    private String reason;

    @Column(name = "triggered_by", length = 64)
    private String triggeredBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
