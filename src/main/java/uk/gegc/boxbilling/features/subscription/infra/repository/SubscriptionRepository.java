package uk.gegc.boxbilling.features.subscription.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.boxbilling.features.subscription.domain.model.Subscription;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionStatus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SubscriptionRepository extends JpaRepository<Subscription, UUID> {

    Optional<Subscription> findByProviderSubscriptionId(String providerSubscriptionId);

    List<Subscription> findByBoxIdAndStatus(UUID boxId, SubscriptionStatus status);

    Optional<Subscription> findFirstByBoxIdAndStatusOrderByCurrentPeriodStartDesc(UUID boxId, SubscriptionStatus status);
}
