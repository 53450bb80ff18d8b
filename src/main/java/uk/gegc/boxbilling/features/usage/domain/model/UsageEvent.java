package uk.gegc.boxbilling.features.usage.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only record of a billable or informational occurrence.
 */
@Entity
@Table(name = "usage_events",
        indexes = @Index(name = "idx_usage_events_box_period", columnList = "box_id, billing_period_start"))
@Getter
@Setter
public class UsageEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "box_id", nullable = false, updatable = false)
    private UUID boxId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, updatable = false, length = 40)
    private UsageEventType eventType;

    @Column(name = "quantity", nullable = false, updatable = false)
    private int quantity = 1;

    @Column(name = "entity_id", updatable = false)
    private UUID entityId;

    @Column(name = "entity_type", updatable = false, length = 40)
    private String entityType;

    @Column(name = "user_id", updatable = false)
    private UUID userId;

    @Column(name = "billable", nullable = false, updatable = false)
    private boolean billable = false;

    @Column(name = "metadata", updatable = false, length = 4000)
    private String metadata;

    @Column(name = "billing_period_start", updatable = false)
    private Instant billingPeriodStart;

    @Column(name = "billing_period_end", updatable = false)
    private Instant billingPeriodEnd;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
