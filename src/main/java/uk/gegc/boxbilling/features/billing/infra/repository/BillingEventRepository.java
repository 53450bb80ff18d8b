package uk.gegc.boxbilling.features.billing.infra.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.boxbilling.features.billing.domain.model.BillingEvent;
import uk.gegc.boxbilling.features.billing.domain.model.BillingEventStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BillingEventRepository extends JpaRepository<BillingEvent, UUID> {

    Optional<BillingEvent> findByProviderEventId(String providerEventId);

    List<BillingEvent> findByStatusAndNextRetryAtLessThanEqualOrderByNextRetryAtAsc(
            BillingEventStatus status, Instant now, Pageable pageable);

    /**
     * Move the event to {@code PROCESSING} if it is still in one of the claimable states.
     *
     * @return 1 when this caller won the claim, 0 otherwise
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        UPDATE BillingEvent e
        SET e.status = :processing, e.lastAttemptAt = :now
        WHERE e.id = :id AND e.status IN :claimable
        """)
    int claimForProcessing(@Param("id") UUID id,
                           @Param("processing") BillingEventStatus processing,
                           @Param("claimable") Collection<BillingEventStatus> claimable,
                           @Param("now") Instant now);
}
