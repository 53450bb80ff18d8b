package uk.gegc.boxbilling.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * A received provider webhook, kept for audit and retry. Rows are never deleted.
 */
@Entity
@Table(name = "billing_events",
        indexes = @Index(name = "idx_billing_events_retry", columnList = "status, next_retry_at"))
@Getter
@Setter
public class BillingEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "provider_event_id", nullable = false, unique = true, updatable = false)
    private String providerEventId;

    @Column(name = "box_id")
    private UUID boxId;

    @Column(name = "event_type", nullable = false, length = 64)
    private String eventType;

    @Lob
    @Column(name = "data", nullable = false)
    private String data;

    @Column(name = "source", length = 32)
    private String source;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private BillingEventStatus status = BillingEventStatus.PENDING;

    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries = 3;

    @Column(name = "processing_error", length = 2000)
    private String processingError;

    @Column(name = "last_attempt_at")
    private Instant lastAttemptAt;

    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
