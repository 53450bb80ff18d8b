package uk.gegc.boxbilling.features.billing.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.boxbilling.features.billing.application.BillingAccountService;
import uk.gegc.boxbilling.features.billing.application.BillingEventProcessor;
import uk.gegc.boxbilling.features.billing.application.BillingMetricsService;
import uk.gegc.boxbilling.features.billing.application.BillingProperties;
import uk.gegc.boxbilling.features.billing.application.BoxResolver;
import uk.gegc.boxbilling.features.billing.application.ProcessingResult;
import uk.gegc.boxbilling.features.billing.application.RetryDrainSummary;
import uk.gegc.boxbilling.features.billing.application.WebhookLoggingContext;
import uk.gegc.boxbilling.features.billing.application.event.BillingEventPayloads;
import uk.gegc.boxbilling.features.billing.application.event.CheckoutSnapshot;
import uk.gegc.boxbilling.features.billing.application.event.CustomerSnapshot;
import uk.gegc.boxbilling.features.billing.application.event.InvoiceSnapshot;
import uk.gegc.boxbilling.features.billing.application.event.NormalizedBillingEvent;
import uk.gegc.boxbilling.features.billing.application.event.SubscriptionSnapshot;
import uk.gegc.boxbilling.features.billing.domain.model.BillingEvent;
import uk.gegc.boxbilling.features.billing.domain.model.BillingEventStatus;
import uk.gegc.boxbilling.features.billing.domain.model.BillingEventType;
import uk.gegc.boxbilling.features.billing.infra.repository.BillingEventRepository;
import uk.gegc.boxbilling.features.subscription.application.SubscriptionLifecycleService;
import uk.gegc.boxbilling.shared.exception.ResourceNotFoundException;
import uk.gegc.boxbilling.shared.exception.ValidationException;
import uk.gegc.boxbilling.shared.util.RequiresNewTransactions;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Stores every event before acting on it, so the event table doubles as idempotency ledger and retry queue.
 * Each step commits on its own: a failing handler rolls back only its own work, never the event row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BillingEventProcessorImpl implements BillingEventProcessor {

    private static final String DEFAULT_SOURCE = "provider";
    private static final int MAX_ERROR_LENGTH = 2000;
    private static final Set<BillingEventStatus> CLAIMABLE =
            EnumSet.of(BillingEventStatus.PENDING, BillingEventStatus.FAILED);

    private final BillingEventRepository billingEventRepository;
    private final SubscriptionLifecycleService lifecycleService;
    private final BillingAccountService accountService;
    private final BoxResolver boxResolver;
    private final BillingMetricsService metricsService;
    private final BillingProperties billingProperties;
    private final RequiresNewTransactions requiresNew;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public ProcessingResult processEvent(NormalizedBillingEvent event) {
        validate(event);
        metricsService.incrementWebhookReceived(event.type());
        return process(event);
    }

    @Override
    public RetryDrainSummary retryFailedEvents() {
        List<BillingEvent> due = billingEventRepository.findByStatusAndNextRetryAtLessThanEqualOrderByNextRetryAtAsc(
                BillingEventStatus.FAILED,
                Instant.now(clock),
                PageRequest.of(0, billingProperties.getWebhook().getRetryBatchSize()));
        if (due.isEmpty()) {
            return RetryDrainSummary.empty();
        }

        int succeeded = 0;
        int failed = 0;
        for (BillingEvent stored : due) {
            try {
                ProcessingResult result = process(rebuild(stored));
                if (result.accepted()) {
                    succeeded++;
                } else {
                    failed++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Retry of billing event {} aborted: {}", stored.getProviderEventId(), e.getMessage(), e);
            }
        }
        log.info("Billing event retry drain: attempted={}, succeeded={}, failed={}", due.size(), succeeded, failed);
        return new RetryDrainSummary(due.size(), succeeded, failed);
    }

    private ProcessingResult process(NormalizedBillingEvent event) {
        long startNanos = System.nanoTime();
        BillingEventType type = BillingEventType.fromWireName(event.type());
        WebhookLoggingContext loggingContext = WebhookLoggingContext.builder()
                .eventId(event.id())
                .eventType(event.type())
                .build();

        try {
            BillingEvent stored = findOrInsert(event);
            loggingContext.setAttempt(stored.getRetryCount() + 1);

            if (stored.getStatus() == BillingEventStatus.PROCESSED || !claim(stored)) {
                metricsService.incrementWebhookDuplicate(event.type());
                loggingContext.logInfo(log, "Duplicate billing event id={} type={} status={}",
                        event.id(), event.type(), stored.getStatus());
                return ProcessingResult.duplicate(event.id());
            }

            try {
                Handled handled = dispatch(type, event, loggingContext);
                requiresNew.call(() -> markProcessed(stored.getId(), handled.boxId()));

                if (handled.ignored()) {
                    metricsService.incrementWebhookIgnored(event.type());
                    loggingContext.logInfo(log, "Ignoring billing event id={} type={} (not handled)", event.id(), event.type());
                    return ProcessingResult.ignored(event.id());
                }
                metricsService.incrementWebhookProcessed(event.type());
                loggingContext.logInfo(log, "Processed billing event id={} type={}", event.id(), event.type());
                return ProcessingResult.processed(event.id());
            } catch (ValidationException e) {
                BillingEvent failed = requiresNew.call(() -> markFailed(stored.getId(), e, false));
                metricsService.incrementWebhookFailed(event.type());
                metricsService.incrementWebhookTerminalFailure(event.type());
                loggingContext.logError(log, "Billing event id={} type={} rejected, not retrying: {}",
                        event.id(), event.type(), e.getMessage(), e);
                return ProcessingResult.failed(event.id(), failed.getProcessingError());
            } catch (RuntimeException e) {
                BillingEvent failed = requiresNew.call(() -> markFailed(stored.getId(), e, true));
                metricsService.incrementWebhookFailed(event.type());
                if (failed.getNextRetryAt() == null) {
                    metricsService.incrementWebhookTerminalFailure(event.type());
                    loggingContext.logError(log, "Billing event id={} type={} failed permanently after {} attempts: {}",
                            event.id(), event.type(), failed.getRetryCount(), e.getMessage(), e);
                } else {
                    loggingContext.logWarn(log, "Billing event id={} type={} failed (attempt {}), retry at {}: {}",
                            event.id(), event.type(), failed.getRetryCount(), failed.getNextRetryAt(), e.getMessage());
                }
                return ProcessingResult.failed(event.id(), failed.getProcessingError());
            }
        } finally {
            metricsService.recordWebhookLatency(event.type(), Duration.ofNanos(System.nanoTime() - startNanos));
            WebhookLoggingContext.clearMDC();
        }
    }

    private Handled dispatch(BillingEventType type, NormalizedBillingEvent event, WebhookLoggingContext loggingContext) {
        JsonNode data = event.data();
        return switch (type) {
            case SUBSCRIPTION_CREATED, SUBSCRIPTION_UPDATED, SUBSCRIPTION_CANCELED, SUBSCRIPTION_REVOKED -> {
                SubscriptionSnapshot subscription = BillingEventPayloads.subscription(data);
                UUID boxId = boxResolver.resolve(event, subscription.providerSubscriptionId(), subscription.providerCustomerId());
                loggingContext.setBoxId(boxId);
                loggingContext.setProviderSubscriptionId(subscription.providerSubscriptionId());
                loggingContext.logInfo(log, "Applying {} for subscription {}", event.type(), subscription.providerSubscriptionId());
                switch (type) {
                    case SUBSCRIPTION_CREATED -> lifecycleService.handleSubscriptionCreated(boxId, subscription);
                    case SUBSCRIPTION_UPDATED -> lifecycleService.handleSubscriptionUpdated(boxId, subscription);
                    case SUBSCRIPTION_CANCELED -> lifecycleService.handleSubscriptionCanceled(boxId, subscription);
                    default -> lifecycleService.handleSubscriptionRevoked(boxId, subscription);
                }
                yield Handled.by(boxId);
            }
            case INVOICE_PAID, INVOICE_PAYMENT_FAILED -> {
                InvoiceSnapshot invoice = BillingEventPayloads.invoice(data);
                UUID boxId = boxResolver.resolve(event, invoice.providerSubscriptionId(), invoice.providerCustomerId());
                loggingContext.setBoxId(boxId);
                loggingContext.setProviderSubscriptionId(invoice.providerSubscriptionId());
                if (type == BillingEventType.INVOICE_PAID) {
                    accountService.recordInvoicePaid(boxId, invoice);
                } else {
                    lifecycleService.handlePaymentFailed(boxId, invoice);
                }
                yield Handled.by(boxId);
            }
            case CUSTOMER_UPDATED -> {
                CustomerSnapshot customer = BillingEventPayloads.customer(data);
                UUID boxId = boxResolver.resolve(event, null, customer.providerCustomerId());
                loggingContext.setBoxId(boxId);
                accountService.upsertCustomer(boxId, customer);
                yield Handled.by(boxId);
            }
            case CHECKOUT_SESSION_COMPLETED -> {
                CheckoutSnapshot checkout = BillingEventPayloads.checkout(data);
                UUID boxId = boxResolver.resolve(event, checkout.providerSubscriptionId(), checkout.providerCustomerId());
                loggingContext.setBoxId(boxId);
                accountService.completeCheckout(boxId, checkout);
                yield Handled.by(boxId);
            }
            case UNKNOWN -> Handled.notHandled();
        };
    }

    private BillingEvent findOrInsert(NormalizedBillingEvent event) {
        return billingEventRepository.findByProviderEventId(event.id())
                .orElseGet(() -> insert(event));
    }

    private BillingEvent insert(NormalizedBillingEvent event) {
        try {
            return requiresNew.call(() -> billingEventRepository.saveAndFlush(newEvent(event)));
        } catch (DataIntegrityViolationException e) {
            if (!RequiresNewTransactions.isDuplicateKey(e)) {
                throw e;
            }
            log.info("Billing event {} stored concurrently; using the existing row", event.id());
            return requiresNew.call(() -> billingEventRepository.findByProviderEventId(event.id()))
                    .orElseThrow(() -> new IllegalStateException("Billing event " + event.id() + " vanished after duplicate insert"));
        }
    }

    private boolean claim(BillingEvent stored) {
        Instant now = Instant.now(clock);
        Integer claimed = requiresNew.call(() -> billingEventRepository.claimForProcessing(
                stored.getId(), BillingEventStatus.PROCESSING, CLAIMABLE, now));
        return claimed != null && claimed > 0;
    }

    private BillingEvent newEvent(NormalizedBillingEvent event) {
        BillingEvent stored = new BillingEvent();
        stored.setProviderEventId(event.id());
        stored.setEventType(event.type());
        stored.setData(toJson(event.data()));
        stored.setSource(event.metadata() != null && StringUtils.hasText(event.metadata().source())
                ? event.metadata().source()
                : DEFAULT_SOURCE);
        if (event.metadata() != null && StringUtils.hasText(event.metadata().boxId())) {
            stored.setBoxId(BoxResolver.parse(event.metadata().boxId()));
        }
        stored.setStatus(BillingEventStatus.PENDING);
        stored.setMaxRetries(billingProperties.getWebhook().getMaxRetries());
        stored.setCreatedAt(Instant.now(clock));
        return stored;
    }

    private BillingEvent markProcessed(UUID id, UUID boxId) {
        BillingEvent stored = load(id);
        stored.setStatus(BillingEventStatus.PROCESSED);
        stored.setProcessedAt(Instant.now(clock));
        stored.setProcessingError(null);
        stored.setNextRetryAt(null);
        if (boxId != null) {
            stored.setBoxId(boxId);
        }
        return billingEventRepository.save(stored);
    }

    /**
     * Exponential backoff from the configured base delay; no next retry once attempts reach the limit
     * or when the payload itself is at fault.
     */
    private BillingEvent markFailed(UUID id, RuntimeException failure, boolean retryable) {
        BillingEvent stored = load(id);
        int previousAttempts = stored.getRetryCount();
        stored.setRetryCount(previousAttempts + 1);
        stored.setStatus(BillingEventStatus.FAILED);
        stored.setProcessingError(truncate(describe(failure)));
        if (!retryable || stored.getRetryCount() >= stored.getMaxRetries()) {
            stored.setNextRetryAt(null);
        } else {
            Duration delay = Duration.ofMinutes(billingProperties.getWebhook().getRetryBaseDelayMinutes())
                    .multipliedBy(1L << previousAttempts);
            stored.setNextRetryAt(Instant.now(clock).plus(delay));
        }
        return billingEventRepository.save(stored);
    }

    private BillingEvent load(UUID id) {
        return billingEventRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Billing event " + id + " not found"));
    }

    private NormalizedBillingEvent rebuild(BillingEvent stored) {
        JsonNode data;
        try {
            data = objectMapper.readTree(stored.getData());
        } catch (JsonProcessingException e) {
            throw new ValidationException("Stored data of billing event " + stored.getProviderEventId() + " is not valid JSON");
        }
        String boxId = stored.getBoxId() != null ? stored.getBoxId().toString() : null;
        return new NormalizedBillingEvent(stored.getEventType(), stored.getProviderEventId(), data,
                new NormalizedBillingEvent.EventMetadata(boxId, stored.getSource()));
    }

    private void validate(NormalizedBillingEvent event) {
        if (event == null) {
            throw new ValidationException("Event is required");
        }
        if (!StringUtils.hasText(event.id())) {
            throw new ValidationException("Event id is required");
        }
        if (!StringUtils.hasText(event.type())) {
            throw new ValidationException("Event type is required");
        }
        if (event.data() == null || !event.data().isObject()) {
            throw new ValidationException("Event data must be an object");
        }
        BillingEventType type = BillingEventType.fromWireName(event.type());
        if (type == BillingEventType.UNKNOWN) {
            return;
        }
        if (BillingEventPayloads.entityId(event.data()) == null) {
            throw new ValidationException("Event data is missing 'id'");
        }
        switch (type) {
            case SUBSCRIPTION_CREATED, SUBSCRIPTION_UPDATED, SUBSCRIPTION_CANCELED, SUBSCRIPTION_REVOKED ->
                    BillingEventPayloads.subscription(event.data());
            case INVOICE_PAID, INVOICE_PAYMENT_FAILED -> BillingEventPayloads.invoice(event.data());
            case CUSTOMER_UPDATED -> BillingEventPayloads.customer(event.data());
            case CHECKOUT_SESSION_COMPLETED -> BillingEventPayloads.checkout(event.data());
            default -> {
            }
        }
        if (event.metadata() != null && StringUtils.hasText(event.metadata().boxId())) {
            BoxResolver.parse(event.metadata().boxId());
        }
        String echoedBoxId = BillingEventPayloads.metadataBoxId(event.data());
        if (echoedBoxId != null) {
            BoxResolver.parse(echoedBoxId);
        }
    }

    private String toJson(JsonNode data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Event data is not serializable");
        }
    }

    private static String describe(RuntimeException failure) {
        String message = failure.getMessage();
        return failure.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    private static String truncate(String value) {
        return value.length() <= MAX_ERROR_LENGTH ? value : value.substring(0, MAX_ERROR_LENGTH);
    }

    private record Handled(UUID boxId, boolean ignored) {

        static Handled by(UUID boxId) {
            return new Handled(boxId, false);
        }

        static Handled notHandled() {
            return new Handled(null, true);
        }
    }
}
