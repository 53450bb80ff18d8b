package uk.gegc.boxbilling.features.usage.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.boxbilling.features.usage.domain.model.OverageBillingRecord;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface OverageBillingRecordRepository extends JpaRepository<OverageBillingRecord, UUID> {

    Optional<OverageBillingRecord> findByBoxIdAndBillingPeriodStartAndBillingPeriodEnd(
            UUID boxId, Instant billingPeriodStart, Instant billingPeriodEnd);

    long countByBoxId(UUID boxId);
}
