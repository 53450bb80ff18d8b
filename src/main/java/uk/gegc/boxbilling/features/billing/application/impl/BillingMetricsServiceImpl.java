package uk.gegc.boxbilling.features.billing.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.boxbilling.features.billing.application.BillingMetricsService;

import java.time.Duration;

/**
 * Micrometer-backed billing metrics. Meters are tagged by event type or reason, and every
 * increment also goes to the log for environments without a metrics backend.
 */
@Slf4j
@Service
public class BillingMetricsServiceImpl implements BillingMetricsService {

    private final MeterRegistry meterRegistry;

    public BillingMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void incrementWebhookReceived(String eventType) {
        webhookCounter("billing.webhooks.received", "Number of billing webhooks received", eventType).increment();
    }

    @Override
    public void incrementWebhookProcessed(String eventType) {
        webhookCounter("billing.webhooks.processed", "Number of billing webhooks processed", eventType).increment();
        log.debug("METRIC: billing.webhooks.processed type={}", eventType);
    }

    @Override
    public void incrementWebhookDuplicate(String eventType) {
        webhookCounter("billing.webhooks.duplicate", "Number of duplicate billing webhooks", eventType).increment();
        log.info("METRIC: billing.webhooks.duplicate type={}", eventType);
    }

    @Override
    public void incrementWebhookIgnored(String eventType) {
        webhookCounter("billing.webhooks.ignored", "Number of unhandled billing webhook types", eventType).increment();
    }

    @Override
    public void incrementWebhookFailed(String eventType) {
        webhookCounter("billing.webhooks.failed", "Number of failed billing webhook attempts", eventType).increment();
        log.warn("METRIC: billing.webhooks.failed type={}", eventType);
    }

    @Override
    public void incrementWebhookTerminalFailure(String eventType) {
        webhookCounter("billing.webhooks.terminal_failures", "Billing webhooks that exhausted their retries", eventType).increment();
        log.error("METRIC: billing.webhooks.terminal_failures type={}", eventType);
    }

    @Override
    public void recordWebhookLatency(String eventType, Duration latency) {
        Timer.builder("billing.webhooks.latency")
                .description("Billing webhook processing latency")
                .tag("type", eventType)
                .register(meterRegistry)
                .record(latency);
    }

    @Override
    public void incrementGracePeriodTriggered(String reason) {
        Counter.builder("billing.grace_periods.triggered")
                .description("Grace periods opened")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
        log.info("METRIC: billing.grace_periods.triggered reason={}", reason);
    }

    @Override
    public void incrementGracePeriodResolved(String reason) {
        Counter.builder("billing.grace_periods.resolved")
                .description("Grace periods resolved")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementOverageRecordCreated() {
        Counter.builder("billing.overage.records.created")
                .description("Overage billing records created")
                .register(meterRegistry)
                .increment();
        log.info("METRIC: billing.overage.records.created");
    }

    @Override
    public void incrementReconciliationCorrection(String kind) {
        Counter.builder("billing.reconciliation.corrections")
                .description("Box status corrections applied by the reconciliation sweep")
                .tag("kind", kind)
                .register(meterRegistry)
                .increment();
        log.info("METRIC: billing.reconciliation.corrections kind={}", kind);
    }

    @Override
    public void incrementAccessDenied(String reason) {
        Counter.builder("billing.access.denied")
                .description("Access checks that returned a denial")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    private Counter webhookCounter(String name, String description, String eventType) {
        return Counter.builder(name)
                .description(description)
                .tag("type", eventType == null ? "unknown" : eventType)
                .register(meterRegistry);
    }
}
