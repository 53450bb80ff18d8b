package uk.gegc.boxbilling.features.subscription.infra.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionChange;

import java.util.List;
import java.util.UUID;

public interface SubscriptionChangeRepository extends JpaRepository<SubscriptionChange, UUID> {

    List<SubscriptionChange> findByBoxIdOrderByCreatedAtDesc(UUID boxId, Pageable pageable);
}
