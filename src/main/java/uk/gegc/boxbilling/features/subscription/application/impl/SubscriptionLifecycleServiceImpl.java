package uk.gegc.boxbilling.features.subscription.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.boxbilling.features.billing.application.BillingProperties;
import uk.gegc.boxbilling.features.billing.application.event.InvoiceSnapshot;
import uk.gegc.boxbilling.features.billing.application.event.SubscriptionSnapshot;
import uk.gegc.boxbilling.features.box.domain.model.Box;
import uk.gegc.boxbilling.features.box.infra.repository.BoxRepository;
import uk.gegc.boxbilling.features.graceperiod.application.GracePeriodOptions;
import uk.gegc.boxbilling.features.graceperiod.application.GracePeriodService;
import uk.gegc.boxbilling.features.graceperiod.domain.model.GracePeriodReason;
import uk.gegc.boxbilling.features.graceperiod.domain.model.GracePeriodResolution;
import uk.gegc.boxbilling.features.subscription.application.BoxStatusTransitions;
import uk.gegc.boxbilling.features.subscription.application.SubscriptionLifecycleService;
import uk.gegc.boxbilling.features.subscription.domain.model.Subscription;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionChange;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionChangeType;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionPlan;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionStatus;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionTier;
import uk.gegc.boxbilling.features.subscription.infra.repository.SubscriptionChangeRepository;
import uk.gegc.boxbilling.features.subscription.infra.repository.SubscriptionPlanRepository;
import uk.gegc.boxbilling.features.subscription.infra.repository.SubscriptionRepository;
import uk.gegc.boxbilling.features.usage.application.UsageEventRecorder;
import uk.gegc.boxbilling.features.usage.domain.model.UsageEventType;
import uk.gegc.boxbilling.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionLifecycleServiceImpl implements SubscriptionLifecycleService {

    private static final String PROVIDER_ACTOR = "provider";
    private static final String SUPERSEDED = "superseded";
    private static final int MAX_HISTORY = 100;
    private static final EnumSet<GracePeriodReason> PAYMENT_REASONS =
            EnumSet.of(GracePeriodReason.PAYMENT_FAILED, GracePeriodReason.BILLING_ISSUE);
    private static final EnumSet<GracePeriodReason> CANCELLATION_REASONS =
            EnumSet.of(GracePeriodReason.SUBSCRIPTION_CANCELED, GracePeriodReason.BILLING_ISSUE);

    private final BoxRepository boxRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final SubscriptionPlanRepository planRepository;
    private final SubscriptionChangeRepository changeRepository;
    private final BoxStatusTransitions boxStatusTransitions;
    private final GracePeriodService gracePeriodService;
    private final UsageEventRecorder usageEventRecorder;
    private final BillingProperties billingProperties;
    private final Clock clock;

    @Override
    @Transactional
    public Subscription handleSubscriptionCreated(UUID boxId, SubscriptionSnapshot snapshot) {
        Box box = loadBox(boxId);
        SubscriptionStatus status = snapshot.status() == SubscriptionStatus.TRIALING
                ? SubscriptionStatus.TRIALING
                : SubscriptionStatus.ACTIVE;

        Upsert upsert = upsert(box, snapshot, status);
        Subscription subscription = upsert.subscription();

        project(box, subscription, upsert.limitsChanged(), snapshot.endsAt());
        boxStatusTransitions.activate(box);
        boxRepository.save(box);
        supersedeOtherActive(box, subscription);
        onActivated(box, PROVIDER_ACTOR);

        recordChange(subscription, upsert.inserted() ? SubscriptionChangeType.CREATED : SubscriptionChangeType.UPDATED,
                upsert.previousStatus(), upsert.previousTier(), null, PROVIDER_ACTOR);
        usageEventRecorder.record(box, UsageEventType.SUBSCRIPTION_CREATED, details(
                "providerSubscriptionId", subscription.getProviderSubscriptionId(),
                "tier", subscription.getPlanTier().getValue(),
                "status", status.getValue()));
        log.info("Subscription {} for box {} is {} on tier {}",
                subscription.getProviderSubscriptionId(), boxId, status.getValue(), subscription.getPlanTier().getValue());
        return subscription;
    }

    @Override
    @Transactional
    public Subscription handleSubscriptionUpdated(UUID boxId, SubscriptionSnapshot snapshot) {
        Box box = loadBox(boxId);
        SubscriptionStatus status = snapshot.status() != null
                ? snapshot.status()
                : subscriptionRepository.findByProviderSubscriptionId(snapshot.providerSubscriptionId())
                        .map(Subscription::getStatus)
                        .orElse(SubscriptionStatus.ACTIVE);

        Upsert upsert = upsert(box, snapshot, status);
        Subscription subscription = upsert.subscription();
        SubscriptionChangeType changeType = upsert.tierChanged()
                ? SubscriptionChangeType.PLAN_CHANGED
                : SubscriptionChangeType.UPDATED;

        if (!isCurrent(box, subscription) && !status.isActiveLike()) {
            log.info("Subscription {} is not the current subscription of box {}, box left unchanged",
                    subscription.getProviderSubscriptionId(), boxId);
            recordChange(subscription, changeType, upsert.previousStatus(), upsert.previousTier(), null, PROVIDER_ACTOR);
            return subscription;
        }

        project(box, subscription, upsert.limitsChanged(), snapshot.endsAt());
        if (upsert.previousStatus() != status) {
            applyStatusChange(box, subscription, upsert.previousStatus(), snapshot);
        }
        boxRepository.save(box);

        recordChange(subscription, changeType, upsert.previousStatus(), upsert.previousTier(), null, PROVIDER_ACTOR);
        usageEventRecorder.record(box,
                upsert.tierChanged() ? UsageEventType.PLAN_CHANGED : UsageEventType.SUBSCRIPTION_UPDATED,
                details("providerSubscriptionId", subscription.getProviderSubscriptionId(),
                        "status", subscription.getStatus().getValue(),
                        "fromTier", upsert.previousTier() == null ? null : upsert.previousTier().getValue(),
                        "toTier", subscription.getPlanTier().getValue()));
        return subscription;
    }

    @Override
    @Transactional
    public Subscription handleSubscriptionCanceled(UUID boxId, SubscriptionSnapshot snapshot) {
        Box box = loadBox(boxId);
        Optional<SubscriptionStatus> previous = subscriptionRepository
                .findByProviderSubscriptionId(snapshot.providerSubscriptionId())
                .map(Subscription::getStatus);

        if (snapshot.cancelAtPeriodEnd()) {
            Upsert upsert = upsert(box, snapshot, SubscriptionStatus.ACTIVE);
            Subscription subscription = upsert.subscription();
            if (isCurrent(box, subscription)) {
                project(box, subscription, upsert.limitsChanged(), snapshot.endsAt());
                boxRepository.save(box);
            }
            recordChange(subscription, SubscriptionChangeType.CANCELLATION_SCHEDULED,
                    upsert.previousStatus(), upsert.previousTier(), snapshot.cancelReason(), PROVIDER_ACTOR);
            usageEventRecorder.record(box, UsageEventType.SUBSCRIPTION_CANCELED, details(
                    "providerSubscriptionId", subscription.getProviderSubscriptionId(),
                    "atPeriodEnd", true,
                    "endsAt", box.getSubscriptionEndsAt() == null ? null : box.getSubscriptionEndsAt().toString()));
            log.info("Subscription {} for box {} cancels at period end ({})",
                    subscription.getProviderSubscriptionId(), boxId, box.getSubscriptionEndsAt());
            return subscription;
        }

        Upsert upsert = upsert(box, snapshot, previous.orElse(SubscriptionStatus.CANCELED));
        Subscription subscription = upsert.subscription();
        Instant canceledAt = snapshot.canceledAt() != null ? snapshot.canceledAt() : Instant.now(clock);
        applyImmediateCancellation(box, subscription, previous.orElse(null), canceledAt, snapshot.cancelReason());

        recordChange(subscription, SubscriptionChangeType.CANCELED,
                previous.orElse(null), upsert.previousTier(), snapshot.cancelReason(), PROVIDER_ACTOR);
        usageEventRecorder.record(box, UsageEventType.SUBSCRIPTION_CANCELED, details(
                "providerSubscriptionId", subscription.getProviderSubscriptionId(),
                "atPeriodEnd", false,
                "reason", snapshot.cancelReason()));
        return subscription;
    }

    @Override
    @Transactional
    public Subscription handleSubscriptionRevoked(UUID boxId, SubscriptionSnapshot snapshot) {
        Box box = loadBox(boxId);
        Optional<SubscriptionStatus> previous = subscriptionRepository
                .findByProviderSubscriptionId(snapshot.providerSubscriptionId())
                .map(Subscription::getStatus);

        Upsert upsert = upsert(box, snapshot, previous.orElse(SubscriptionStatus.CANCELED));
        Subscription subscription = upsert.subscription();
        Instant now = Instant.now(clock);
        subscription.setStatus(SubscriptionStatus.CANCELED);
        subscription.setCancelAtPeriodEnd(false);
        if (subscription.getCanceledAt() == null) {
            subscription.setCanceledAt(snapshot.canceledAt() != null ? snapshot.canceledAt() : now);
        }
        if (subscription.getCancelReason() == null) {
            subscription.setCancelReason(snapshot.cancelReason() != null ? snapshot.cancelReason() : "revoked");
        }
        subscriptionRepository.save(subscription);

        if (isCurrent(box, subscription)) {
            endBoxSubscription(box, subscription.getCanceledAt());
            boxStatusTransitions.suspend(box);
            boxRepository.save(box);
        }

        recordChange(subscription, SubscriptionChangeType.REVOKED,
                previous.orElse(null), upsert.previousTier(), subscription.getCancelReason(), PROVIDER_ACTOR);
        usageEventRecorder.record(box, UsageEventType.SUBSCRIPTION_REVOKED, details(
                "providerSubscriptionId", subscription.getProviderSubscriptionId()));
        log.info("Subscription {} for box {} revoked", subscription.getProviderSubscriptionId(), boxId);
        return subscription;
    }

    @Override
    @Transactional
    public Subscription handlePaymentFailed(UUID boxId, InvoiceSnapshot invoice) {
        Box box = loadBox(boxId);
        String providerSubscriptionId = invoice.providerSubscriptionId() != null
                ? invoice.providerSubscriptionId()
                : box.getProviderSubscriptionId();
        if (providerSubscriptionId == null) {
            throw new ResourceNotFoundException("Box " + boxId + " has no subscription to mark past due");
        }
        Subscription subscription = subscriptionRepository.findByProviderSubscriptionId(providerSubscriptionId)
                .orElseThrow(() -> new ResourceNotFoundException("Subscription " + providerSubscriptionId + " not found"));

        if (subscription.getStatus().isTerminal()) {
            log.warn("Payment failure for {} subscription {} ignored", subscription.getStatus().getValue(), providerSubscriptionId);
            return subscription;
        }

        SubscriptionStatus previous = subscription.getStatus();
        applyPaymentFailure(box, subscription, details(
                "invoiceId", invoice.invoiceId(),
                "amount", invoice.amount(),
                "currency", invoice.currency(),
                "failureReason", invoice.failureReason()));

        recordChange(subscription, SubscriptionChangeType.PAYMENT_FAILED, previous, subscription.getPlanTier(),
                invoice.failureReason(), PROVIDER_ACTOR);
        usageEventRecorder.record(box, UsageEventType.PAYMENT_FAILED, details(
                "invoiceId", invoice.invoiceId(),
                "amount", invoice.amount()));
        return subscription;
    }

    @Override
    @Transactional
    public Subscription cancelSubscription(UUID boxId, boolean cancelAtPeriodEnd, String reason, String userId) {
        Box box = loadBox(boxId);
        Subscription subscription = currentSubscription(box);
        if (subscription.getStatus().isTerminal()) {
            throw new IllegalStateException("Subscription " + subscription.getProviderSubscriptionId() + " is already canceled");
        }
        SubscriptionStatus previous = subscription.getStatus();

        if (cancelAtPeriodEnd) {
            subscription.setCancelAtPeriodEnd(true);
            subscription.setCancelReason(reason);
            subscriptionRepository.save(subscription);
            box.setSubscriptionEndsAt(earliest(box.getSubscriptionEndsAt(), subscription.getCurrentPeriodEnd()));
            box.setNextBillingDate(null);
            boxRepository.save(box);
            recordChange(subscription, SubscriptionChangeType.CANCELLATION_SCHEDULED, previous,
                    subscription.getPlanTier(), reason, userId);
        } else {
            applyImmediateCancellation(box, subscription, previous, Instant.now(clock), reason);
            recordChange(subscription, SubscriptionChangeType.CANCELED, previous, subscription.getPlanTier(), reason, userId);
        }

        usageEventRecorder.record(box, UsageEventType.SUBSCRIPTION_CANCELED, details(
                "providerSubscriptionId", subscription.getProviderSubscriptionId(),
                "atPeriodEnd", cancelAtPeriodEnd,
                "reason", reason,
                "canceledBy", userId));
        log.info("Box {} subscription canceled by {} (atPeriodEnd={})", boxId, userId, cancelAtPeriodEnd);
        return subscription;
    }

    @Override
    @Transactional
    public Subscription reactivateSubscription(UUID boxId, String userId) {
        Box box = loadBox(boxId);
        Subscription subscription = currentSubscription(box);
        Instant now = Instant.now(clock);
        if (!subscription.getCurrentPeriodEnd().isAfter(now)) {
            throw new IllegalStateException("Current billing period has ended, a new subscription is required");
        }
        if (subscription.getStatus() != SubscriptionStatus.CANCELED && !subscription.isCancelAtPeriodEnd()) {
            throw new IllegalStateException("Subscription " + subscription.getProviderSubscriptionId() + " is not canceled");
        }

        SubscriptionStatus previous = subscription.getStatus();
        subscription.setStatus(SubscriptionStatus.ACTIVE);
        subscription.setCancelAtPeriodEnd(false);
        subscription.setCanceledAt(null);
        subscription.setCancelReason(null);
        subscriptionRepository.save(subscription);

        box.setSubscriptionStatus(SubscriptionStatus.ACTIVE);
        box.setSubscriptionEndsAt(subscription.getCurrentPeriodEnd());
        box.setNextBillingDate(subscription.getCurrentPeriodEnd());
        boxStatusTransitions.activate(box);
        boxRepository.save(box);
        supersedeOtherActive(box, subscription);

        gracePeriodService.resolveForReasons(boxId, CANCELLATION_REASONS,
                GracePeriodResolution.SUBSCRIPTION_REACTIVATED, userId, false);

        recordChange(subscription, SubscriptionChangeType.REACTIVATED, previous, subscription.getPlanTier(), null, userId);
        usageEventRecorder.record(box, UsageEventType.SUBSCRIPTION_REACTIVATED, details(
                "providerSubscriptionId", subscription.getProviderSubscriptionId(),
                "reactivatedBy", userId));
        log.info("Box {} subscription reactivated by {}", boxId, userId);
        return subscription;
    }

    @Override
    @Transactional
    public Subscription applyPlanChange(UUID boxId, SubscriptionPlan toPlan, String reason, String userId) {
        Box box = loadBox(boxId);
        Subscription subscription = currentSubscription(box);
        if (subscription.getStatus().isTerminal()) {
            throw new IllegalStateException("Subscription " + subscription.getProviderSubscriptionId() + " is canceled");
        }
        SubscriptionTier previousTier = subscription.getPlanTier();
        subscription.setPlanId(toPlan.getId());
        subscription.setPlanTier(toPlan.getTier());
        subscription.setPlanVersion(toPlan.getVersion());
        subscriptionRepository.save(subscription);

        project(box, subscription, true, null);
        boxRepository.save(box);

        recordChange(subscription, SubscriptionChangeType.PLAN_CHANGED, subscription.getStatus(), previousTier, reason, userId);
        usageEventRecorder.record(box, UsageEventType.PLAN_CHANGED, details(
                "providerSubscriptionId", subscription.getProviderSubscriptionId(),
                "fromTier", previousTier.getValue(),
                "toTier", toPlan.getTier().getValue(),
                "changedBy", userId));
        log.info("Box {} moved from {} to {} by {}", boxId, previousTier.getValue(), toPlan.getTier().getValue(), userId);
        return subscription;
    }

    @Override
    @Transactional(readOnly = true)
    public List<SubscriptionChange> getSubscriptionHistory(UUID boxId, int limit) {
        if (limit < 1 || limit > MAX_HISTORY) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_HISTORY);
        }
        if (!boxRepository.existsById(boxId)) {
            throw new ResourceNotFoundException("Box " + boxId + " not found");
        }
        return changeRepository.findByBoxIdOrderByCreatedAtDesc(boxId, PageRequest.of(0, limit));
    }

    private void applyStatusChange(Box box, Subscription subscription, SubscriptionStatus previous,
                                   SubscriptionSnapshot snapshot) {
        switch (subscription.getStatus()) {
            case ACTIVE, TRIALING -> {
                boxStatusTransitions.activate(box);
                supersedeOtherActive(box, subscription);
                onActivated(box, PROVIDER_ACTOR);
            }
            case PAST_DUE -> applyPaymentFailure(box, subscription, details(
                    "source", "subscription.updated",
                    "providerSubscriptionId", subscription.getProviderSubscriptionId()));
            case CANCELED -> applyImmediateCancellation(box, subscription, previous,
                    snapshot.canceledAt() != null ? snapshot.canceledAt() : Instant.now(clock),
                    snapshot.cancelReason());
            case REVOKED, UNPAID, INCOMPLETE_EXPIRED -> boxStatusTransitions.suspend(box);
            default -> log.debug("Subscription {} moved to {}, no box status effect",
                    subscription.getProviderSubscriptionId(), subscription.getStatus().getValue());
        }
    }

    /**
     * Past due keeps the period running but marks the box and opens a critical grace period.
     */
    private void applyPaymentFailure(Box box, Subscription subscription, Map<String, Object> context) {
        subscription.setStatus(SubscriptionStatus.PAST_DUE);
        subscriptionRepository.save(subscription);
        if (isCurrent(box, subscription)) {
            box.setSubscriptionStatus(SubscriptionStatus.PAST_DUE);
            boxStatusTransitions.markPaymentFailed(box);
            boxRepository.save(box);
        }
        gracePeriodService.trigger(box.getId(), GracePeriodReason.PAYMENT_FAILED, GracePeriodOptions.withContext(context));
        log.warn("Payment failed for subscription {} of box {}", subscription.getProviderSubscriptionId(), box.getId());
    }

    /**
     * A repeated cancellation of an already canceled subscription only re-asserts the suspended box.
     */
    private void applyImmediateCancellation(Box box, Subscription subscription, SubscriptionStatus previous,
                                            Instant canceledAt, String reason) {
        boolean alreadyCanceled = previous == SubscriptionStatus.CANCELED;
        subscription.setStatus(SubscriptionStatus.CANCELED);
        subscription.setCancelAtPeriodEnd(false);
        if (subscription.getCanceledAt() == null) {
            subscription.setCanceledAt(canceledAt);
        }
        if (reason != null) {
            subscription.setCancelReason(reason);
        }
        subscriptionRepository.save(subscription);

        if (!isCurrent(box, subscription)) {
            return;
        }
        endBoxSubscription(box, subscription.getCanceledAt());
        boxStatusTransitions.suspend(box);
        boxRepository.save(box);

        if (!alreadyCanceled) {
            gracePeriodService.trigger(box.getId(), GracePeriodReason.SUBSCRIPTION_CANCELED,
                    GracePeriodOptions.withContext(details(
                            "providerSubscriptionId", subscription.getProviderSubscriptionId(),
                            "reason", reason)));
        }
        log.info("Subscription {} for box {} canceled immediately", subscription.getProviderSubscriptionId(), box.getId());
    }

    private void onActivated(Box box, String actor) {
        gracePeriodService.resolveForReasons(box.getId(), PAYMENT_REASONS,
                GracePeriodResolution.PAYMENT_RECEIVED, actor, true);
        gracePeriodService.resolveForReasons(box.getId(), EnumSet.of(GracePeriodReason.SUBSCRIPTION_CANCELED),
                GracePeriodResolution.SUBSCRIPTION_REACTIVATED, actor, true);
    }

    /**
     * Keeps at most one active subscription per box: any other active one is canceled as superseded.
     */
    private void supersedeOtherActive(Box box, Subscription subscription) {
        if (subscription.getStatus() != SubscriptionStatus.ACTIVE) {
            return;
        }
        Instant now = Instant.now(clock);
        for (Subscription other : subscriptionRepository.findByBoxIdAndStatus(box.getId(), SubscriptionStatus.ACTIVE)) {
            if (other.getId().equals(subscription.getId())) {
                continue;
            }
            other.setStatus(SubscriptionStatus.CANCELED);
            other.setCanceledAt(now);
            other.setCancelReason(SUPERSEDED);
            subscriptionRepository.save(other);
            recordChange(other, SubscriptionChangeType.SUPERSEDED, SubscriptionStatus.ACTIVE, other.getPlanTier(),
                    "Superseded by " + subscription.getProviderSubscriptionId(), PROVIDER_ACTOR);
            log.info("Subscription {} of box {} superseded by {}",
                    other.getProviderSubscriptionId(), box.getId(), subscription.getProviderSubscriptionId());
        }
    }

    private Upsert upsert(Box box, SubscriptionSnapshot snapshot, SubscriptionStatus status) {
        Optional<Subscription> existing = subscriptionRepository.findByProviderSubscriptionId(snapshot.providerSubscriptionId());
        boolean inserted = existing.isEmpty();
        Subscription subscription = existing.orElseGet(Subscription::new);
        if (!inserted && !subscription.getBoxId().equals(box.getId())) {
            throw new IllegalStateException("Subscription " + snapshot.providerSubscriptionId()
                    + " belongs to box " + subscription.getBoxId() + ", not " + box.getId());
        }
        SubscriptionStatus previousStatus = inserted ? null : subscription.getStatus();
        SubscriptionTier previousTier = inserted ? null : subscription.getPlanTier();

        SubscriptionTier tier = resolveTier(snapshot, previousTier);
        if (inserted || tier != previousTier) {
            SubscriptionPlan plan = currentPlan(tier);
            subscription.setPlanId(plan.getId());
            subscription.setPlanTier(plan.getTier());
            subscription.setPlanVersion(plan.getVersion());
        }

        Instant now = Instant.now(clock);
        Instant periodStart = firstNonNull(snapshot.currentPeriodStart(), subscription.getCurrentPeriodStart(), now);
        Instant periodEnd = firstNonNull(snapshot.currentPeriodEnd(), subscription.getCurrentPeriodEnd(),
                periodStart.atZone(ZoneOffset.UTC).plusMonths(1).toInstant());

        subscription.setBoxId(box.getId());
        subscription.setProviderSubscriptionId(snapshot.providerSubscriptionId());
        if (snapshot.providerCustomerId() != null) {
            subscription.setProviderCustomerId(snapshot.providerCustomerId());
        }
        subscription.setStatus(status);
        subscription.setCurrentPeriodStart(periodStart);
        subscription.setCurrentPeriodEnd(periodEnd);
        subscription.setCancelAtPeriodEnd(snapshot.cancelAtPeriodEnd());
        if (snapshot.canceledAt() != null) {
            subscription.setCanceledAt(snapshot.canceledAt());
        }
        if (snapshot.cancelReason() != null) {
            subscription.setCancelReason(snapshot.cancelReason());
        }
        if (snapshot.currency() != null) {
            subscription.setCurrency(snapshot.currency());
        }
        if (snapshot.amount() != null) {
            subscription.setAmount(snapshot.amount());
        }
        if (snapshot.interval() != null) {
            subscription.setInterval(snapshot.interval());
        }

        Subscription saved = subscriptionRepository.save(subscription);
        return new Upsert(saved, inserted, previousStatus, previousTier, !inserted && tier != previousTier);
    }

    /**
     * Copy the subscription onto the box projection read by the access check.
     */
    private void project(Box box, Subscription subscription, boolean updateLimits, Instant cancellationEffectiveAt) {
        box.setProviderSubscriptionId(subscription.getProviderSubscriptionId());
        if (subscription.getProviderCustomerId() != null) {
            box.setProviderCustomerId(subscription.getProviderCustomerId());
        }
        box.setSubscriptionStatus(subscription.getStatus());
        box.setSubscriptionTier(subscription.getPlanTier());
        if (box.getSubscriptionStartsAt() == null) {
            box.setSubscriptionStartsAt(subscription.getCurrentPeriodStart());
        }
        if (subscription.isCancelAtPeriodEnd()) {
            box.setSubscriptionEndsAt(earliest(subscription.getCurrentPeriodEnd(), cancellationEffectiveAt));
            box.setNextBillingDate(null);
        } else {
            box.setSubscriptionEndsAt(subscription.getCurrentPeriodEnd());
            box.setNextBillingDate(subscription.getCurrentPeriodEnd());
        }
        if (updateLimits) {
            planRepository.findById(subscription.getPlanId()).ifPresent(plan -> {
                box.setCurrentAthleteLimit(plan.getAthleteLimit());
                box.setCurrentCoachLimit(plan.getCoachLimit());
                log.info("Box {} limits set to {} athletes / {} coaches ({})",
                        box.getId(), plan.getAthleteLimit(), plan.getCoachLimit(), plan.getTier().getValue());
            });
        }
    }

    private void endBoxSubscription(Box box, Instant endedAt) {
        box.setSubscriptionStatus(SubscriptionStatus.CANCELED);
        box.setSubscriptionEndsAt(earliest(box.getSubscriptionEndsAt(), endedAt));
        box.setNextBillingDate(null);
    }

    private boolean isCurrent(Box box, Subscription subscription) {
        return box.getProviderSubscriptionId() == null
                || box.getProviderSubscriptionId().equals(subscription.getProviderSubscriptionId());
    }

    private Subscription currentSubscription(Box box) {
        if (box.getProviderSubscriptionId() != null) {
            return subscriptionRepository.findByProviderSubscriptionId(box.getProviderSubscriptionId())
                    .orElseThrow(() -> new ResourceNotFoundException(
                            "Subscription " + box.getProviderSubscriptionId() + " not found"));
        }
        return subscriptionRepository
                .findFirstByBoxIdAndStatusOrderByCurrentPeriodStartDesc(box.getId(), SubscriptionStatus.ACTIVE)
                .orElseThrow(() -> new ResourceNotFoundException("Box " + box.getId() + " has no subscription"));
    }

    private SubscriptionTier resolveTier(SubscriptionSnapshot snapshot, SubscriptionTier fallback) {
        if (snapshot.tier() != null) {
            return snapshot.tier();
        }
        if (snapshot.productId() != null) {
            SubscriptionTier mapped = billingProperties.getPlans().getProductTiers().get(snapshot.productId());
            if (mapped != null) {
                return mapped;
            }
        }
        if (fallback != null) {
            return fallback;
        }
        throw new ResourceNotFoundException("No plan tier mapped for product " + snapshot.productId());
    }

    private SubscriptionPlan currentPlan(SubscriptionTier tier) {
        return planRepository.findByTierAndCurrentVersionTrue(tier)
                .orElseThrow(() -> new ResourceNotFoundException("No current plan for tier " + tier.getValue()));
    }

    private void recordChange(Subscription subscription, SubscriptionChangeType type, SubscriptionStatus fromStatus,
                              SubscriptionTier fromTier, String reason, String triggeredBy) {
        SubscriptionChange change = new SubscriptionChange();
        change.setBoxId(subscription.getBoxId());
        change.setSubscriptionId(subscription.getId());
        change.setChangeType(type);
        change.setFromStatus(fromStatus);
        change.setToStatus(subscription.getStatus());
        change.setFromTier(fromTier);
        change.setToTier(subscription.getPlanTier());
        change.setReason(reason);
        change.setTriggeredBy(triggeredBy);
        change.setCreatedAt(Instant.now(clock));
        changeRepository.save(change);
    }

    private Box loadBox(UUID boxId) {
        return boxRepository.findById(boxId)
                .orElseThrow(() -> new ResourceNotFoundException("Box " + boxId + " not found"));
    }

    private static Instant earliest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isBefore(b) ? a : b;
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * Key/value pairs as an ordered map, skipping null values.
     */
    private static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        return map;
    }

    private record Upsert(
            Subscription subscription,
            boolean inserted,
            SubscriptionStatus previousStatus,
            SubscriptionTier previousTier,
            boolean tierChanged
    ) {
        boolean limitsChanged() {
            return inserted || tierChanged;
        }
    }
}
