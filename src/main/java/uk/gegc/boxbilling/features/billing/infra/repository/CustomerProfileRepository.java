package uk.gegc.boxbilling.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.boxbilling.features.billing.domain.model.CustomerProfile;

import java.util.Optional;
import java.util.UUID;

public interface CustomerProfileRepository extends JpaRepository<CustomerProfile, UUID> {

    Optional<CustomerProfile> findByProviderCustomerId(String providerCustomerId);
}
