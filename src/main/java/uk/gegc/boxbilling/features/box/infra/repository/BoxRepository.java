package uk.gegc.boxbilling.features.box.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.boxbilling.features.box.domain.model.Box;
import uk.gegc.boxbilling.features.box.domain.model.BoxStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface BoxRepository extends JpaRepository<Box, UUID> {

    Optional<Box> findByProviderSubscriptionId(String providerSubscriptionId);

    Optional<Box> findFirstByProviderCustomerId(String providerCustomerId);

    List<Box> findByOverageEnabledTrueAndStatus(BoxStatus status);

    /**
     * Trials that ran out without a provider subscription ever being attached.
     */
    @Query("""
            SELECT b FROM Box b
            WHERE b.subscriptionStatus = uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionStatus.TRIAL
              AND b.trialEndsAt < :now
              AND b.providerSubscriptionId IS NULL
              AND b.status <> uk.gegc.boxbilling.features.box.domain.model.BoxStatus.TRIAL_EXPIRED
            """)
    List<Box> findExpiredTrialsWithoutSubscription(@Param("now") Instant now);

    /**
     * Active boxes whose linked subscription is canceled (or scheduled to cancel) and whose
     * paid-through date has passed.
     */
    @Query("""
            SELECT DISTINCT b FROM Box b, Subscription s
            WHERE s.providerSubscriptionId = b.providerSubscriptionId
              AND b.status = uk.gegc.boxbilling.features.box.domain.model.BoxStatus.ACTIVE
              AND b.subscriptionEndsAt < :now
              AND (s.status = uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionStatus.CANCELED
                   OR s.cancelAtPeriodEnd = true)
            """)
    List<Box> findActiveBoxesWithLapsedCancellation(@Param("now") Instant now);
}
