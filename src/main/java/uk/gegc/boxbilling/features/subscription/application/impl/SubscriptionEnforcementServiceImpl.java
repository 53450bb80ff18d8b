package uk.gegc.boxbilling.features.subscription.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.boxbilling.features.billing.application.BillingMetricsService;
import uk.gegc.boxbilling.features.box.domain.model.Box;
import uk.gegc.boxbilling.features.box.domain.model.BoxStatus;
import uk.gegc.boxbilling.features.box.infra.repository.BoxRepository;
import uk.gegc.boxbilling.features.subscription.application.BoxStatusTransitions;
import uk.gegc.boxbilling.features.subscription.application.EnforcementSummary;
import uk.gegc.boxbilling.features.subscription.application.SubscriptionEnforcementService;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionStatus;
import uk.gegc.boxbilling.features.usage.application.UsageEventRecorder;
import uk.gegc.boxbilling.features.usage.domain.model.UsageEventType;
import uk.gegc.boxbilling.shared.util.RequiresNewTransactions;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionEnforcementServiceImpl implements SubscriptionEnforcementService {

    private final BoxRepository boxRepository;
    private final BoxStatusTransitions boxStatusTransitions;
    private final UsageEventRecorder usageEventRecorder;
    private final BillingMetricsService metricsService;
    private final RequiresNewTransactions requiresNew;
    private final Clock clock;

    @Override
    public EnforcementSummary enforceSubscriptionRules() {
        Instant now = Instant.now(clock);
        int trialsExpired = 0;
        int boxesSuspended = 0;
        int failures = 0;

        List<Box> expiredTrials = boxRepository.findExpiredTrialsWithoutSubscription(now);
        for (Box candidate : expiredTrials) {
            try {
                if (Boolean.TRUE.equals(requiresNew.call(() -> expireTrial(candidate.getId(), now)))) {
                    trialsExpired++;
                    metricsService.incrementReconciliationCorrection("trial_expired");
                }
            } catch (RuntimeException e) {
                failures++;
                log.error("Failed to expire trial for box {}: {}", candidate.getId(), e.getMessage(), e);
            }
        }

        List<Box> lapsed = boxRepository.findActiveBoxesWithLapsedCancellation(now);
        for (Box candidate : lapsed) {
            try {
                if (Boolean.TRUE.equals(requiresNew.call(() -> suspendLapsed(candidate.getId(), now)))) {
                    boxesSuspended++;
                    metricsService.incrementReconciliationCorrection("suspended");
                }
            } catch (RuntimeException e) {
                failures++;
                log.error("Failed to suspend box {} after its subscription ended: {}", candidate.getId(), e.getMessage(), e);
            }
        }

        EnforcementSummary summary = new EnforcementSummary(trialsExpired, boxesSuspended, failures);
        log.info("Subscription enforcement finished: trialsExpired={}, boxesSuspended={}, failures={}",
                summary.trialsExpired(), summary.boxesSuspended(), summary.failures());
        return summary;
    }

    /**
     * Re-checks the conditions on a fresh read; a webhook may have linked a subscription meanwhile.
     */
    private boolean expireTrial(UUID boxId, Instant now) {
        Box box = boxRepository.findById(boxId).orElse(null);
        if (box == null
                || box.getSubscriptionStatus() != SubscriptionStatus.TRIAL
                || box.getProviderSubscriptionId() != null
                || box.getTrialEndsAt() == null
                || !box.getTrialEndsAt().isBefore(now)) {
            return false;
        }
        if (!boxStatusTransitions.markTrialExpired(box)) {
            return false;
        }
        boxRepository.save(box);
        usageEventRecorder.record(box, UsageEventType.TRIAL_EXPIRED, Map.of("trialEndsAt", box.getTrialEndsAt().toString()));
        return true;
    }

    private boolean suspendLapsed(UUID boxId, Instant now) {
        Box box = boxRepository.findById(boxId).orElse(null);
        if (box == null
                || box.getStatus() != BoxStatus.ACTIVE
                || box.getSubscriptionEndsAt() == null
                || !box.getSubscriptionEndsAt().isBefore(now)) {
            return false;
        }
        if (!boxStatusTransitions.suspend(box)) {
            return false;
        }
        boxRepository.save(box);
        log.info("Box {} suspended: subscription {} ended at {}",
                boxId, box.getProviderSubscriptionId(), box.getSubscriptionEndsAt());
        return true;
    }
}
