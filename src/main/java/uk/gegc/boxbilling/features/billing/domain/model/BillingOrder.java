package uk.gegc.boxbilling.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * A paid provider invoice. One row per provider order id.
 */
@Entity
@Table(name = "orders")
@Getter
@Setter
public class BillingOrder {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "box_id", nullable = false)
    private UUID boxId;

    @Column(name = "subscription_id")
    private UUID subscriptionId;

    @Column(name = "provider_order_id", nullable = false, unique = true)
    private String providerOrderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_type", nullable = false, length = 16)
    private OrderType orderType = OrderType.SUBSCRIPTION;

    @Column(name = "status", nullable = false, length = 32)
    private String status;

    @Column(name = "amount", nullable = false)
    private long amount;

    @Column(name = "currency", nullable = false, length = 10)
    private String currency;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
