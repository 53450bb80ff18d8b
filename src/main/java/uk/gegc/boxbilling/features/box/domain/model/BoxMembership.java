package uk.gegc.boxbilling.features.box.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * A user's role within a box. Owned by the membership feature; the billing engine only counts rows.
 */
@Entity
@Table(name = "box_memberships")
@Getter
@Setter
public class BoxMembership {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "box_id", nullable = false)
    private UUID boxId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private MembershipRole role;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "joined_at")
    private Instant joinedAt;
}
