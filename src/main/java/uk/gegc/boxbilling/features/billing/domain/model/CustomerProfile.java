package uk.gegc.boxbilling.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "customer_profiles")
@Getter
@Setter
public class CustomerProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "box_id", nullable = false)
    private UUID boxId;

    @Column(name = "provider_customer_id", nullable = false, unique = true)
    private String providerCustomerId;

    @Column(name = "email")
    private String email;

    @Column(name = "name")
    private String name;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
