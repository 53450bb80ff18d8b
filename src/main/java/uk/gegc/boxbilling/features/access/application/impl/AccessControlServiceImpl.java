package uk.gegc.boxbilling.features.access.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import uk.gegc.boxbilling.features.access.application.AccessControlService;
import uk.gegc.boxbilling.features.access.application.AccessDecision;
import uk.gegc.boxbilling.features.access.domain.model.BoxFeature;
import uk.gegc.boxbilling.features.billing.application.BillingMetricsService;
import uk.gegc.boxbilling.features.box.domain.model.Box;
import uk.gegc.boxbilling.features.box.domain.model.BoxStatus;
import uk.gegc.boxbilling.features.box.infra.repository.BoxRepository;
import uk.gegc.boxbilling.features.subscription.application.BoxStatusTransitions;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionStatus;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionTier;
import uk.gegc.boxbilling.features.usage.application.SubscriptionUsage;
import uk.gegc.boxbilling.features.usage.application.UsageTrackingService;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AccessControlServiceImpl implements AccessControlService {

    static final String BOX_NOT_FOUND = "Box not found";
    static final String TRIAL_EXPIRED = "Trial expired without subscription";
    static final String NO_SUBSCRIPTION = "No active subscription or trial";
    static final String PERIOD_ENDED = "Subscription period ended";
    static final String CHECK_FAILED = "Access check failed";

    private final BoxRepository boxRepository;
    private final BoxStatusTransitions boxStatusTransitions;
    private final UsageTrackingService usageTrackingService;
    private final BillingMetricsService metricsService;
    private final Clock clock;

    @Override
    public AccessDecision checkAccess(UUID boxId) {
        try {
            Optional<Box> box = boxRepository.findById(boxId);
            if (box.isEmpty()) {
                return denied(boxId, BOX_NOT_FOUND);
            }
            return decide(box.get());
        } catch (DataAccessException e) {
            log.error("Access check for box {} failed: {}", boxId, e.getMessage(), e);
            return denied(boxId, CHECK_FAILED);
        }
    }

    @Override
    public AccessDecision checkFeatureAccess(UUID boxId, String feature) {
        AccessDecision base = checkAccess(boxId);
        if (!base.hasAccess()) {
            return base;
        }
        Optional<BoxFeature> requested = BoxFeature.fromValue(feature);
        if (requested.isEmpty()) {
            return AccessDecision.deny("Unknown feature: " + feature);
        }

        try {
            Box box = boxRepository.findById(boxId).orElse(null);
            if (box == null) {
                return denied(boxId, BOX_NOT_FOUND);
            }
            return switch (requested.get()) {
                case ADD_ATHLETE -> {
                    SubscriptionUsage usage = usageTrackingService.calculateUsage(boxId);
                    yield box.isOverageEnabled() || usage.athletes() < usage.athleteLimit()
                            ? AccessDecision.allow()
                            : denied(boxId, "Athlete limit reached");
                }
                case ADD_COACH -> {
                    SubscriptionUsage usage = usageTrackingService.calculateUsage(boxId);
                    yield box.isOverageEnabled() || usage.coaches() < usage.coachLimit()
                            ? AccessDecision.allow()
                            : denied(boxId, "Coach limit reached");
                }
                case ADVANCED_ANALYTICS -> box.getSubscriptionTier() == SubscriptionTier.GROW
                        || box.getSubscriptionTier() == SubscriptionTier.SCALE
                        ? AccessDecision.allow()
                        : denied(boxId, "Advanced analytics requires the grow or scale plan");
                case API_ACCESS -> box.getSubscriptionTier() == SubscriptionTier.SCALE
                        ? AccessDecision.allow()
                        : denied(boxId, "API access requires the scale plan");
            };
        } catch (DataAccessException e) {
            log.error("Feature access check {} for box {} failed: {}", feature, boxId, e.getMessage(), e);
            return denied(boxId, CHECK_FAILED);
        }
    }

    /**
     * First matching rule wins.
     */
    private AccessDecision decide(Box box) {
        Instant now = Instant.now(clock);

        if (box.getStatus() != BoxStatus.ACTIVE) {
            return denied(box.getId(), box.getStatus().getValue());
        }

        SubscriptionStatus subscriptionStatus = box.getSubscriptionStatus();
        if (subscriptionStatus == SubscriptionStatus.TRIAL) {
            if (box.getTrialEndsAt() == null || box.getTrialEndsAt().isAfter(now)) {
                return AccessDecision.allow();
            }
            if (box.getProviderSubscriptionId() == null) {
                expireTrial(box);
                return denied(box.getId(), TRIAL_EXPIRED);
            }
        }

        if (box.getProviderSubscriptionId() == null && subscriptionStatus != SubscriptionStatus.TRIALING) {
            return denied(box.getId(), NO_SUBSCRIPTION);
        }

        boolean periodRunning = box.getSubscriptionEndsAt() == null || box.getSubscriptionEndsAt().isAfter(now);
        if (subscriptionStatus != null && subscriptionStatus.grantsAccess() && periodRunning) {
            return AccessDecision.allow();
        }
        if (subscriptionStatus != null && !subscriptionStatus.grantsAccess()) {
            return denied(box.getId(), subscriptionStatus.getValue());
        }
        return denied(box.getId(), PERIOD_ENDED);
    }

    private void expireTrial(Box box) {
        if (!boxStatusTransitions.markTrialExpired(box)) {
            return;
        }
        try {
            boxRepository.save(box);
        } catch (OptimisticLockingFailureException e) {
            log.warn("Box {} changed while expiring its trial, leaving the correction to the next check", box.getId());
        }
    }

    private AccessDecision denied(UUID boxId, String reason) {
        metricsService.incrementAccessDenied(reason);
        log.debug("Access denied for box {}: {}", boxId, reason);
        return AccessDecision.deny(reason);
    }
}
