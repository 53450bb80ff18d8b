package uk.gegc.boxbilling.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.boxbilling.features.billing.domain.model.CheckoutSession;

import java.util.Optional;
import java.util.UUID;

public interface CheckoutSessionRepository extends JpaRepository<CheckoutSession, UUID> {

    Optional<CheckoutSession> findByProviderCheckoutId(String providerCheckoutId);
}
