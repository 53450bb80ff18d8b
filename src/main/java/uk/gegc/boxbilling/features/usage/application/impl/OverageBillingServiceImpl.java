package uk.gegc.boxbilling.features.usage.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.boxbilling.features.billing.application.BillingMetricsService;
import uk.gegc.boxbilling.features.billing.application.BillingNotificationService;
import uk.gegc.boxbilling.features.box.domain.model.Box;
import uk.gegc.boxbilling.features.box.domain.model.BoxStatus;
import uk.gegc.boxbilling.features.box.infra.repository.BoxRepository;
import uk.gegc.boxbilling.features.subscription.domain.model.Subscription;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionPlan;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionStatus;
import uk.gegc.boxbilling.features.subscription.infra.repository.SubscriptionPlanRepository;
import uk.gegc.boxbilling.features.subscription.infra.repository.SubscriptionRepository;
import uk.gegc.boxbilling.features.usage.application.OverageBillingResult;
import uk.gegc.boxbilling.features.usage.application.OverageBillingService;
import uk.gegc.boxbilling.features.usage.application.OverageCalculation;
import uk.gegc.boxbilling.features.usage.application.OverageRunSummary;
import uk.gegc.boxbilling.features.usage.application.UsageEventRecorder;
import uk.gegc.boxbilling.features.usage.application.UsageTrackingService;
import uk.gegc.boxbilling.features.usage.application.SubscriptionUsage;
import uk.gegc.boxbilling.features.usage.domain.model.OverageBillingRecord;
import uk.gegc.boxbilling.features.usage.domain.model.OverageBillingStatus;
import uk.gegc.boxbilling.features.usage.domain.model.UsageEventType;
import uk.gegc.boxbilling.features.usage.infra.repository.OverageBillingRecordRepository;
import uk.gegc.boxbilling.shared.exception.ResourceNotFoundException;
import uk.gegc.boxbilling.shared.util.RequiresNewTransactions;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class OverageBillingServiceImpl implements OverageBillingService {

    private final BoxRepository boxRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final SubscriptionPlanRepository planRepository;
    private final OverageBillingRecordRepository overageRepository;
    private final UsageTrackingService usageTrackingService;
    private final UsageEventRecorder usageEventRecorder;
    private final BillingNotificationService notificationService;
    private final BillingMetricsService metricsService;
    private final RequiresNewTransactions requiresNew;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<OverageCalculation> calculateOverageForPeriod(UUID boxId, UUID subscriptionId,
                                                                  Instant periodStart, Instant periodEnd) {
        if (!periodStart.isBefore(periodEnd)) {
            throw new IllegalArgumentException("Billing period start must be before its end");
        }
        Box box = loadBox(boxId);
        Subscription subscription = subscriptionRepository.findById(subscriptionId)
                .orElseThrow(() -> new ResourceNotFoundException("Subscription " + subscriptionId + " not found"));
        SubscriptionPlan plan = planRepository.findById(subscription.getPlanId()).orElse(null);

        SubscriptionUsage usage = usageTrackingService.calculateUsage(boxId, plan, box);
        if (!usage.hasOverage()) {
            return Optional.empty();
        }
        return Optional.of(OverageCalculation.from(usage));
    }

    @Override
    @Transactional
    public OverageBillingResult calculateOverageBilling(UUID boxId) {
        Box box = loadBox(boxId);
        if (!box.isOverageEnabled()) {
            return OverageBillingResult.none("Overage billing not enabled");
        }
        Optional<Subscription> active = subscriptionRepository
                .findFirstByBoxIdAndStatusOrderByCurrentPeriodStartDesc(boxId, SubscriptionStatus.ACTIVE);
        if (active.isEmpty()) {
            return OverageBillingResult.none("No active subscription");
        }
        Subscription subscription = active.get();
        Instant periodStart = subscription.getCurrentPeriodStart();
        Instant periodEnd = subscription.getCurrentPeriodEnd();

        Optional<OverageBillingRecord> existing = overageRepository
                .findByBoxIdAndBillingPeriodStartAndBillingPeriodEnd(boxId, periodStart, periodEnd);
        if (existing.isPresent()) {
            return OverageBillingResult.existing(existing.get());
        }

        Optional<OverageCalculation> calculation = calculateOverageForPeriod(boxId, subscription.getId(), periodStart, periodEnd);
        if (calculation.isEmpty()) {
            return OverageBillingResult.none("No overage");
        }

        OverageBillingRecord record = newRecord(box, subscription, calculation.get());
        OverageBillingRecord saved;
        try {
            saved = requiresNew.call(() -> overageRepository.saveAndFlush(record));
        } catch (DataIntegrityViolationException e) {
            if (!RequiresNewTransactions.isDuplicateKey(e)) {
                throw e;
            }
            log.info("Overage for box {} period {} - {} calculated concurrently, re-reading", boxId, periodStart, periodEnd);
            OverageBillingRecord winner = requiresNew.call(() -> overageRepository
                            .findByBoxIdAndBillingPeriodStartAndBillingPeriodEnd(boxId, periodStart, periodEnd))
                    .orElseThrow(() -> e);
            return OverageBillingResult.existing(winner);
        }

        usageEventRecorder.record(box, UsageEventType.OVERAGE_CALCULATED, Map.of(
                "overageBillingId", saved.getId().toString(),
                "athleteOverage", saved.getAthleteOverage(),
                "coachOverage", saved.getCoachOverage(),
                "totalOverageAmount", saved.getTotalOverageAmount()));
        metricsService.incrementOverageRecordCreated();
        log.info("Overage charge {} for box {} period {} - {}: athletes +{}, coaches +{}, total {}",
                saved.getId(), boxId, periodStart, periodEnd,
                saved.getAthleteOverage(), saved.getCoachOverage(), saved.getTotalOverageAmount());
        try {
            notificationService.overageCalculated(saved);
        } catch (RuntimeException e) {
            log.warn("Overage notification for box {} failed: {}", boxId, e.getMessage());
        }
        return OverageBillingResult.created(saved);
    }

    @Override
    public OverageRunSummary processPeriodOverageBilling() {
        List<Box> boxes = boxRepository.findByOverageEnabledTrueAndStatus(BoxStatus.ACTIVE);
        int created = 0;
        int alreadyCalculated = 0;
        int failures = 0;
        for (Box box : boxes) {
            try {
                OverageBillingResult result = requiresNew.call(() -> calculateOverageBilling(box.getId()));
                if (result.created()) {
                    created++;
                } else if (result.hasRecord()) {
                    alreadyCalculated++;
                }
            } catch (RuntimeException e) {
                failures++;
                log.error("Overage billing failed for box {}: {}", box.getId(), e.getMessage(), e);
            }
        }
        OverageRunSummary summary = new OverageRunSummary(boxes.size(), created, alreadyCalculated, failures);
        log.info("Overage billing run finished: {}", summary);
        return summary;
    }

    @Override
    @Transactional
    public OverageBillingRecord markPaid(UUID overageBillingId, String providerInvoiceId) {
        OverageBillingRecord record = overageRepository.findById(overageBillingId)
                .orElseThrow(() -> new ResourceNotFoundException("Overage billing record " + overageBillingId + " not found"));
        if (record.getStatus() == OverageBillingStatus.PAID) {
            return record;
        }
        if (record.getStatus() == OverageBillingStatus.WAIVED) {
            throw new IllegalStateException("Overage billing record " + overageBillingId + " was waived");
        }
        record.setStatus(OverageBillingStatus.PAID);
        record.setProviderInvoiceId(providerInvoiceId);
        record.setPaidAt(Instant.now(clock));
        return overageRepository.save(record);
    }

    private OverageBillingRecord newRecord(Box box, Subscription subscription, OverageCalculation calculation) {
        OverageBillingRecord record = new OverageBillingRecord();
        record.setBoxId(box.getId());
        record.setSubscriptionId(subscription.getId());
        record.setBillingPeriodStart(subscription.getCurrentPeriodStart());
        record.setBillingPeriodEnd(subscription.getCurrentPeriodEnd());
        record.setAthleteLimit(calculation.athleteLimit());
        record.setCoachLimit(calculation.coachLimit());
        record.setAthleteCount(calculation.athleteCount());
        record.setCoachCount(calculation.coachCount());
        record.setAthleteOverage(calculation.athleteOverage());
        record.setCoachOverage(calculation.coachOverage());
        record.setAthleteOverageRate(calculation.athleteOverageRate());
        record.setCoachOverageRate(calculation.coachOverageRate());
        record.setAthleteOverageAmount(calculation.athleteOverageAmount());
        record.setCoachOverageAmount(calculation.coachOverageAmount());
        record.setTotalOverageAmount(calculation.totalOverageAmount());
        record.setStatus(OverageBillingStatus.CALCULATED);
        record.setCreatedAt(Instant.now(clock));
        return record;
    }

    private Box loadBox(UUID boxId) {
        return boxRepository.findById(boxId)
                .orElseThrow(() -> new ResourceNotFoundException("Box " + boxId + " not found"));
    }
}
