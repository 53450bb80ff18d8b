package uk.gegc.boxbilling.features.graceperiod.application;

import uk.gegc.boxbilling.features.graceperiod.domain.model.GracePeriod;
import uk.gegc.boxbilling.features.graceperiod.domain.model.GracePeriodReason;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Opens and closes grace periods, the time-boxed windows that keep a box usable while a limit
 * breach or billing problem is sorted out.
 */
public interface GracePeriodService {

    /**
     * Open a grace period for the box, or return the one already open for the same reason.
     *
     * @param boxId   the box
     * @param reason  why; fixes the duration and default severity
     * @param options optional overrides, may be {@code null}
     * @return the grace period and whether it already existed
     */
    GracePeriodTriggerResult trigger(UUID boxId, GracePeriodReason reason, GracePeriodOptions options);

    /**
     * Resolve a grace period. Resolving an already resolved period returns it unchanged.
     *
     * @throws uk.gegc.boxbilling.shared.exception.ResourceNotFoundException if no such grace period exists
     */
    GracePeriod resolve(UUID gracePeriodId, String resolution, String resolvedBy, boolean autoResolved);

    /**
     * Resolve every unresolved grace period of the box whose reason is in {@code reasons}.
     *
     * @return number of grace periods resolved
     */
    int resolveForReasons(UUID boxId, Collection<GracePeriodReason> reasons, String resolution,
                          String resolvedBy, boolean autoResolved);

    List<GracePeriod> getActiveGracePeriods(UUID boxId);

    List<GracePeriod> getUpcomingExpirations(int daysAhead);

    /**
     * Switch the box to overage billing, closing its limit-exceeded grace periods.
     *
     * @return number of grace periods resolved
     */
    int enableOverageBilling(UUID boxId, String userId);
}
