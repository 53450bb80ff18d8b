package uk.gegc.boxbilling.features.graceperiod.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.boxbilling.features.graceperiod.domain.model.GracePeriod;
import uk.gegc.boxbilling.features.graceperiod.domain.model.GracePeriodReason;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface GracePeriodRepository extends JpaRepository<GracePeriod, UUID> {

    Optional<GracePeriod> findByOpenDedupKey(String openDedupKey);

    Optional<GracePeriod> findFirstByBoxIdAndReasonAndResolvedFalseAndEndsAtGreaterThanEqual(
            UUID boxId, GracePeriodReason reason, Instant now);

    List<GracePeriod> findByBoxIdAndResolvedFalseAndEndsAtGreaterThanEqualOrderByEndsAtAsc(UUID boxId, Instant now);

    List<GracePeriod> findByBoxIdAndResolvedFalseAndReasonIn(UUID boxId, Collection<GracePeriodReason> reasons);

    List<GracePeriod> findByResolvedFalseAndEndsAtBetweenOrderByEndsAtAsc(Instant from, Instant to);

    long countByBoxId(UUID boxId);
}
