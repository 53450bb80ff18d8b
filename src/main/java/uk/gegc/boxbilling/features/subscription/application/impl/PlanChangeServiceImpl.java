package uk.gegc.boxbilling.features.subscription.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.boxbilling.features.box.infra.repository.BoxRepository;
import uk.gegc.boxbilling.features.subscription.application.PlanChangeService;
import uk.gegc.boxbilling.features.subscription.application.SubscriptionLifecycleService;
import uk.gegc.boxbilling.features.subscription.domain.model.PlanChangeDirection;
import uk.gegc.boxbilling.features.subscription.domain.model.PlanChangeRequest;
import uk.gegc.boxbilling.features.subscription.domain.model.PlanChangeStatus;
import uk.gegc.boxbilling.features.subscription.domain.model.ProrationType;
import uk.gegc.boxbilling.features.subscription.domain.model.Subscription;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionPlan;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionStatus;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionTier;
import uk.gegc.boxbilling.features.subscription.infra.repository.PlanChangeRequestRepository;
import uk.gegc.boxbilling.features.subscription.infra.repository.SubscriptionPlanRepository;
import uk.gegc.boxbilling.features.subscription.infra.repository.SubscriptionRepository;
import uk.gegc.boxbilling.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class PlanChangeServiceImpl implements PlanChangeService {

    static final String PLAN_CHANGE_REASON = "plan_change_request";
    private static final long SECONDS_PER_DAY = Duration.ofDays(1).getSeconds();

    private final PlanChangeRequestRepository requestRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final SubscriptionPlanRepository planRepository;
    private final BoxRepository boxRepository;
    private final SubscriptionLifecycleService lifecycleService;
    private final Clock clock;

    @Override
    @Transactional
    public PlanChangeRequest requestPlanChange(UUID boxId, SubscriptionTier toTier, ProrationType prorationType,
                                               Instant effectiveDate, String requestedBy) {
        if (!boxRepository.existsById(boxId)) {
            throw new ResourceNotFoundException("Box " + boxId + " not found");
        }
        Subscription subscription = subscriptionRepository
                .findFirstByBoxIdAndStatusOrderByCurrentPeriodStartDesc(boxId, SubscriptionStatus.ACTIVE)
                .orElseThrow(() -> new IllegalStateException("Box " + boxId + " has no active subscription"));
        if (subscription.getPlanTier() == toTier) {
            throw new IllegalStateException("Box " + boxId + " is already on the " + toTier.getValue() + " plan");
        }
        if (requestRepository.existsByBoxIdAndStatus(boxId, PlanChangeStatus.PENDING)) {
            throw new IllegalStateException("Box " + boxId + " already has a pending plan change");
        }

        SubscriptionPlan fromPlan = plan(subscription.getPlanId());
        SubscriptionPlan toPlan = planRepository.findByTierAndCurrentVersionTrue(toTier)
                .orElseThrow(() -> new ResourceNotFoundException("No current plan for tier " + toTier.getValue()));
        Instant now = Instant.now(clock);

        PlanChangeRequest request = new PlanChangeRequest();
        request.setBoxId(boxId);
        request.setSubscriptionId(subscription.getId());
        request.setFromPlanId(fromPlan.getId());
        request.setToPlanId(toPlan.getId());
        request.setFromTier(fromPlan.getTier());
        request.setToTier(toPlan.getTier());
        request.setDirection(PlanChangeDirection.between(fromPlan.getMonthlyPrice(), toPlan.getMonthlyPrice()));
        request.setProrationType(prorationType != null ? prorationType : ProrationType.IMMEDIATE);
        request.setStatus(PlanChangeStatus.PENDING);
        request.setRequestedEffectiveDate(effectiveDate != null ? effectiveDate : now);
        request.setRequestedBy(requestedBy);
        request.setCreatedAt(now);
        request.setUpdatedAt(now);
        PlanChangeRequest saved = requestRepository.save(request);
        log.info("Plan change {} requested for box {}: {} -> {} ({})", saved.getId(), boxId,
                fromPlan.getTier().getValue(), toPlan.getTier().getValue(), saved.getDirection());
        return saved;
    }

    @Override
    @Transactional
    public PlanChangeRequest approvePlanChange(UUID requestId, String approvedBy) {
        PlanChangeRequest request = load(requestId);
        if (!request.isPending()) {
            throw new IllegalStateException("Plan change " + requestId + " is " + request.getStatus().name().toLowerCase());
        }
        Subscription subscription = subscriptionRepository.findById(request.getSubscriptionId())
                .orElseThrow(() -> new ResourceNotFoundException("Subscription " + request.getSubscriptionId() + " not found"));
        if (subscription.getStatus() != SubscriptionStatus.ACTIVE) {
            throw new IllegalStateException("Subscription " + subscription.getProviderSubscriptionId()
                    + " is no longer active; cancel plan change " + requestId);
        }
        SubscriptionPlan fromPlan = plan(request.getFromPlanId());
        SubscriptionPlan toPlan = plan(request.getToPlanId());
        Instant now = Instant.now(clock);

        long currentPrice = subscription.getAmount() != null ? subscription.getAmount() : fromPlan.getMonthlyPrice();
        long prorated = prorate(subscription, currentPrice, toPlan.getMonthlyPrice(), request.getProrationType(), now);

        request.setStatus(PlanChangeStatus.APPROVED);
        request.setApprovedBy(approvedBy);
        request.setApprovedAt(now);
        request.setProratedAmount(prorated);
        request.setUpdatedAt(now);
        PlanChangeRequest saved = requestRepository.save(request);

        lifecycleService.applyPlanChange(request.getBoxId(), toPlan, PLAN_CHANGE_REASON, approvedBy);
        log.info("Plan change {} approved by {} (prorated amount {})", requestId, approvedBy, prorated);
        return saved;
    }

    @Override
    @Transactional
    public PlanChangeRequest cancelPlanChange(UUID requestId, String canceledBy, String reason) {
        PlanChangeRequest request = load(requestId);
        if (!request.isPending()) {
            throw new IllegalStateException("Plan change " + requestId + " is " + request.getStatus().name().toLowerCase());
        }
        request.setStatus(PlanChangeStatus.CANCELED);
        request.setCanceledBy(canceledBy);
        request.setCancelReason(reason);
        request.setUpdatedAt(Instant.now(clock));
        log.info("Plan change {} canceled by {}", requestId, canceledBy);
        return requestRepository.save(request);
    }

    @Override
    @Transactional(readOnly = true)
    public List<PlanChangeRequest> getPendingPlanChanges(UUID boxId) {
        return requestRepository.findByBoxIdAndStatusOrderByCreatedAtDesc(boxId, PlanChangeStatus.PENDING);
    }

    /**
     * Charge for the new plan minus refund for the old one over the days left in the period, both at
     * the daily rate of the full period. Zero unless the change is prorated immediately.
     */
    static long prorate(Subscription subscription, long currentPrice, long newPrice, ProrationType type, Instant now) {
        if (type != ProrationType.IMMEDIATE) {
            return 0L;
        }
        long totalDays = daysBetween(subscription.getCurrentPeriodStart(), subscription.getCurrentPeriodEnd());
        if (totalDays == 0) {
            return 0L;
        }
        long remainingDays = Math.min(totalDays, daysBetween(now, subscription.getCurrentPeriodEnd()));
        return Math.round((double) (newPrice - currentPrice) * remainingDays / totalDays);
    }

    // Whole days, rounded up; zero when end is not after start.
    private static long daysBetween(Instant start, Instant end) {
        long seconds = Duration.between(start, end).getSeconds();
        return seconds <= 0 ? 0L : (seconds + SECONDS_PER_DAY - 1) / SECONDS_PER_DAY;
    }

    private SubscriptionPlan plan(UUID planId) {
        return planRepository.findById(planId)
                .orElseThrow(() -> new ResourceNotFoundException("Plan " + planId + " not found"));
    }

    private PlanChangeRequest load(UUID requestId) {
        return requestRepository.findById(requestId)
                .orElseThrow(() -> new ResourceNotFoundException("Plan change " + requestId + " not found"));
    }
}
