package uk.gegc.boxbilling.features.subscription.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionPlan;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionTier;

import java.util.Optional;
import java.util.UUID;

public interface SubscriptionPlanRepository extends JpaRepository<SubscriptionPlan, UUID> {

    Optional<SubscriptionPlan> findByTierAndCurrentVersionTrue(SubscriptionTier tier);
}
