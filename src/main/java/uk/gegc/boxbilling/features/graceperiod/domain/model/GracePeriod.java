package uk.gegc.boxbilling.features.graceperiod.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * A time-boxed exception that preserves access during a limit breach or billing problem.
 *
 * <p>{@code openDedupKey} holds {@code boxId:reason} while the period is unresolved and is cleared on
 * resolution, so the unique index on it allows one open period per box and reason while keeping any
 * number of resolved ones.</p>
 */
@Entity
@Table(name = "grace_periods",
        indexes = @Index(name = "idx_grace_periods_box_resolved", columnList = "box_id, resolved"))
@Getter
@Setter
public class GracePeriod {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "box_id", nullable = false)
    private UUID boxId;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false, length = 32)
    private GracePeriodReason reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 16)
    private GracePeriodSeverity severity;

    @Column(name = "ends_at", nullable = false)
    private Instant endsAt;

    @Column(name = "auto_resolve", nullable = false)
    private boolean autoResolve = true;

    @Column(name = "resolved", nullable = false)
    private boolean resolved = false;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "resolution")
    private String resolution;

    @Column(name = "resolved_by", length = 64)
    private String resolvedBy;

    @Column(name = "auto_resolved", nullable = false)
    private boolean autoResolved = false;

    @Column(name = "context_snapshot", length = 4000)
    private String contextSnapshot;

    @Column(name = "open_dedup_key", unique = true, length = 80)
    private String openDedupKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static String dedupKey(UUID boxId, GracePeriodReason reason) {
        return boxId + ":" + reason.getValue();
    }

    public boolean isActiveAt(Instant now) {
        return !resolved && !endsAt.isBefore(now);
    }
}
