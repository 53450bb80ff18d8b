package uk.gegc.boxbilling.features.billing.application;

import uk.gegc.boxbilling.features.billing.application.event.CheckoutSnapshot;
import uk.gegc.boxbilling.features.billing.application.event.CustomerSnapshot;
import uk.gegc.boxbilling.features.billing.application.event.InvoiceSnapshot;
import uk.gegc.boxbilling.features.billing.domain.model.BillingOrder;
import uk.gegc.boxbilling.features.billing.domain.model.CheckoutSession;
import uk.gegc.boxbilling.features.billing.domain.model.CustomerProfile;

import java.util.UUID;

/**
 * Bookkeeping for provider events that never move the box status: paid invoices, customer details and
 * completed checkouts.
 */
public interface BillingAccountService {

    /**
     * Record a paid invoice as an order. An invoice that settles an overage charge also marks that charge paid.
     */
    BillingOrder recordInvoicePaid(UUID boxId, InvoiceSnapshot invoice);

    CustomerProfile upsertCustomer(UUID boxId, CustomerSnapshot customer);

    CheckoutSession completeCheckout(UUID boxId, CheckoutSnapshot checkout);
}
