package uk.gegc.boxbilling.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.boxbilling.features.billing.domain.model.BillingOrder;

import java.util.Optional;
import java.util.UUID;

public interface BillingOrderRepository extends JpaRepository<BillingOrder, UUID> {

    Optional<BillingOrder> findByProviderOrderId(String providerOrderId);
}
