package uk.gegc.boxbilling.features.subscription.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.boxbilling.features.subscription.domain.model.PlanChangeRequest;
import uk.gegc.boxbilling.features.subscription.domain.model.PlanChangeStatus;

import java.util.List;
import java.util.UUID;

public interface PlanChangeRequestRepository extends JpaRepository<PlanChangeRequest, UUID> {

    List<PlanChangeRequest> findByBoxIdAndStatusOrderByCreatedAtDesc(UUID boxId, PlanChangeStatus status);

    boolean existsByBoxIdAndStatus(UUID boxId, PlanChangeStatus status);
}
