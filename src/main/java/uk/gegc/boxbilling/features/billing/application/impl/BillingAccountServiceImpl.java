package uk.gegc.boxbilling.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.boxbilling.features.billing.application.BillingAccountService;
import uk.gegc.boxbilling.features.billing.application.event.CheckoutSnapshot;
import uk.gegc.boxbilling.features.billing.application.event.CustomerSnapshot;
import uk.gegc.boxbilling.features.billing.application.event.InvoiceSnapshot;
import uk.gegc.boxbilling.features.billing.domain.model.BillingOrder;
import uk.gegc.boxbilling.features.billing.domain.model.CheckoutSession;
import uk.gegc.boxbilling.features.billing.domain.model.CheckoutStatus;
import uk.gegc.boxbilling.features.billing.domain.model.CustomerProfile;
import uk.gegc.boxbilling.features.billing.domain.model.OrderType;
import uk.gegc.boxbilling.features.billing.infra.repository.BillingOrderRepository;
import uk.gegc.boxbilling.features.billing.infra.repository.CheckoutSessionRepository;
import uk.gegc.boxbilling.features.billing.infra.repository.CustomerProfileRepository;
import uk.gegc.boxbilling.features.box.domain.model.Box;
import uk.gegc.boxbilling.features.box.infra.repository.BoxRepository;
import uk.gegc.boxbilling.features.subscription.domain.model.Subscription;
import uk.gegc.boxbilling.features.subscription.infra.repository.SubscriptionRepository;
import uk.gegc.boxbilling.features.usage.application.OverageBillingService;
import uk.gegc.boxbilling.features.usage.application.UsageEventRecorder;
import uk.gegc.boxbilling.features.usage.domain.model.UsageEventType;
import uk.gegc.boxbilling.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class BillingAccountServiceImpl implements BillingAccountService {

    private final BoxRepository boxRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final BillingOrderRepository orderRepository;
    private final CustomerProfileRepository customerProfileRepository;
    private final CheckoutSessionRepository checkoutSessionRepository;
    private final OverageBillingService overageBillingService;
    private final UsageEventRecorder usageEventRecorder;
    private final Clock clock;

    @Override
    @Transactional
    public BillingOrder recordInvoicePaid(UUID boxId, InvoiceSnapshot invoice) {
        Box box = loadBox(boxId);

        BillingOrder existing = orderRepository.findByProviderOrderId(invoice.invoiceId()).orElse(null);
        if (existing != null) {
            log.info("Invoice {} already recorded as order {}", invoice.invoiceId(), existing.getId());
            return existing;
        }

        BillingOrder order = new BillingOrder();
        order.setBoxId(boxId);
        order.setProviderOrderId(invoice.invoiceId());
        order.setOrderType(invoice.overageBillingId() != null ? OrderType.OVERAGE : OrderType.SUBSCRIPTION);
        order.setStatus(invoice.status() != null ? invoice.status() : "paid");
        order.setAmount(invoice.amount());
        order.setCurrency(invoice.currency());
        order.setPaidAt(invoice.paidAt() != null ? invoice.paidAt() : Instant.now(clock));
        order.setCreatedAt(Instant.now(clock));
        if (invoice.providerSubscriptionId() != null) {
            subscriptionRepository.findByProviderSubscriptionId(invoice.providerSubscriptionId())
                    .map(Subscription::getId)
                    .ifPresent(order::setSubscriptionId);
        }
        BillingOrder saved = orderRepository.save(order);

        if (invoice.overageBillingId() != null) {
            overageBillingService.markPaid(invoice.overageBillingId(), invoice.invoiceId());
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("invoiceId", invoice.invoiceId());
        metadata.put("amount", invoice.amount());
        metadata.put("currency", invoice.currency());
        metadata.put("orderType", saved.getOrderType().name());
        usageEventRecorder.record(box, UsageEventType.INVOICE_PAID, metadata);

        log.info("Recorded paid invoice {} for box {} ({} {})",
                invoice.invoiceId(), boxId, invoice.amount(), invoice.currency());
        return saved;
    }

    @Override
    @Transactional
    public CustomerProfile upsertCustomer(UUID boxId, CustomerSnapshot customer) {
        Box box = loadBox(boxId);
        CustomerProfile profile = customerProfileRepository.findByProviderCustomerId(customer.providerCustomerId())
                .orElseGet(CustomerProfile::new);
        profile.setBoxId(boxId);
        profile.setProviderCustomerId(customer.providerCustomerId());
        if (customer.email() != null) {
            profile.setEmail(customer.email());
        }
        if (customer.name() != null) {
            profile.setName(customer.name());
        }
        profile.setUpdatedAt(Instant.now(clock));
        CustomerProfile saved = customerProfileRepository.save(profile);

        linkCustomer(box, customer.providerCustomerId());
        return saved;
    }

    @Override
    @Transactional
    public CheckoutSession completeCheckout(UUID boxId, CheckoutSnapshot checkout) {
        Box box = loadBox(boxId);
        CheckoutSession session = checkoutSessionRepository.findByProviderCheckoutId(checkout.providerCheckoutId())
                .orElseGet(CheckoutSession::new);
        if (session.getStatus() == CheckoutStatus.COMPLETED && session.getId() != null) {
            log.info("Checkout {} already completed", checkout.providerCheckoutId());
            return session;
        }
        session.setBoxId(boxId);
        session.setProviderCheckoutId(checkout.providerCheckoutId());
        session.setStatus(CheckoutStatus.COMPLETED);
        if (checkout.tier() != null) {
            session.setPlanTier(checkout.tier());
        }
        session.setCompletedAt(Instant.now(clock));
        CheckoutSession saved = checkoutSessionRepository.save(session);

        if (checkout.providerCustomerId() != null) {
            linkCustomer(box, checkout.providerCustomerId());
        }
        log.info("Checkout {} completed for box {}", checkout.providerCheckoutId(), boxId);
        return saved;
    }

    private void linkCustomer(Box box, String providerCustomerId) {
        if (providerCustomerId.equals(box.getProviderCustomerId())) {
            return;
        }
        box.setProviderCustomerId(providerCustomerId);
        boxRepository.save(box);
        log.info("Box {} linked to customer {}", box.getId(), providerCustomerId);
    }

    private Box loadBox(UUID boxId) {
        return boxRepository.findById(boxId)
                .orElseThrow(() -> new ResourceNotFoundException("Box " + boxId + " not found"));
    }
}
