package uk.gegc.boxbilling.features.usage.application;

import uk.gegc.boxbilling.features.usage.domain.model.OverageBillingRecord;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Derives per-period overage charges. A box is charged at most once per billing period.
 */
public interface OverageBillingService {

    /**
     * Compute the overage for a period without persisting anything.
     *
     * @return empty when the box is within its limits
     */
    Optional<OverageCalculation> calculateOverageForPeriod(UUID boxId, UUID subscriptionId, Instant periodStart, Instant periodEnd);

    /**
     * Charge the box's current period. Repeated calls for the same period return the first record.
     */
    OverageBillingResult calculateOverageBilling(UUID boxId);

    /**
     * Run {@link #calculateOverageBilling(UUID)} for every active box that bills overage.
     */
    OverageRunSummary processPeriodOverageBilling();

    OverageBillingRecord markPaid(UUID overageBillingId, String providerInvoiceId);
}
