package uk.gegc.boxbilling.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionTier;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "checkout_sessions")
@Getter
@Setter
public class CheckoutSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "box_id", nullable = false)
    private UUID boxId;

    @Column(name = "provider_checkout_id", nullable = false, unique = true)
    private String providerCheckoutId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private CheckoutStatus status = CheckoutStatus.OPEN;

    @Enumerated(EnumType.STRING)
    @Column(name = "plan_tier", length = 16)
    private SubscriptionTier planTier;

    @Column(name = "completed_at")
    private Instant completedAt;
}
