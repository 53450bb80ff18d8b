package uk.gegc.boxbilling.features.billing.application.event;

import java.time.Instant;
import java.util.UUID;

/**
 * @param overageBillingId set when the invoice settles an overage charge
 */
public record InvoiceSnapshot(
        String invoiceId,
        String providerSubscriptionId,
        String providerCustomerId,
        long amount,
        String currency,
        String status,
        Instant paidAt,
        UUID overageBillingId,
        String failureReason
) {
}
