package uk.gegc.boxbilling.features.usage.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.boxbilling.features.billing.application.BillingProperties;
import uk.gegc.boxbilling.features.box.domain.model.Box;
import uk.gegc.boxbilling.features.box.domain.model.MembershipRole;
import uk.gegc.boxbilling.features.box.infra.repository.BoxMembershipRepository;
import uk.gegc.boxbilling.features.box.infra.repository.BoxRepository;
import uk.gegc.boxbilling.features.graceperiod.application.GracePeriodOptions;
import uk.gegc.boxbilling.features.graceperiod.application.GracePeriodService;
import uk.gegc.boxbilling.features.graceperiod.application.GracePeriodTriggerResult;
import uk.gegc.boxbilling.features.graceperiod.domain.model.GracePeriodReason;
import uk.gegc.boxbilling.features.subscription.domain.model.Subscription;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionPlan;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionStatus;
import uk.gegc.boxbilling.features.subscription.infra.repository.SubscriptionPlanRepository;
import uk.gegc.boxbilling.features.subscription.infra.repository.SubscriptionRepository;
import uk.gegc.boxbilling.features.usage.application.BillingPeriod;
import uk.gegc.boxbilling.features.usage.application.LimitCheckResult;
import uk.gegc.boxbilling.features.usage.application.SubscriptionUsage;
import uk.gegc.boxbilling.features.usage.application.UsageEventRecorder;
import uk.gegc.boxbilling.features.usage.application.UsageEventRequest;
import uk.gegc.boxbilling.features.usage.application.UsageTrackingResult;
import uk.gegc.boxbilling.features.usage.application.UsageTrackingService;
import uk.gegc.boxbilling.features.usage.domain.model.UsageEventType;
import uk.gegc.boxbilling.shared.exception.ResourceNotFoundException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class UsageTrackingServiceImpl implements UsageTrackingService {

    private static final EnumSet<MembershipRole> ATHLETE_ROLES = EnumSet.of(MembershipRole.ATHLETE);
    private static final EnumSet<MembershipRole> COACH_ROLES = EnumSet.of(MembershipRole.COACH, MembershipRole.HEAD_COACH);
    private static final int APPROACHING_LIMIT_PERCENT = 90;

    private final BoxRepository boxRepository;
    private final BoxMembershipRepository membershipRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final SubscriptionPlanRepository planRepository;
    private final GracePeriodService gracePeriodService;
    private final UsageEventRecorder usageEventRecorder;
    private final BillingProperties billingProperties;

    @Override
    @Transactional(readOnly = true)
    public SubscriptionUsage calculateUsage(UUID boxId) {
        Box box = loadBox(boxId);
        SubscriptionPlan plan = subscriptionRepository
                .findFirstByBoxIdAndStatusOrderByCurrentPeriodStartDesc(boxId, SubscriptionStatus.ACTIVE)
                .map(Subscription::getPlanId)
                .flatMap(planRepository::findById)
                .orElse(null);
        return calculateUsage(boxId, plan, box);
    }

    @Override
    @Transactional(readOnly = true)
    public SubscriptionUsage calculateUsage(UUID boxId, SubscriptionPlan plan, Box box) {
        Box target = box != null ? box : loadBox(boxId);

        int athletes = (int) membershipRepository.countByBoxIdAndActiveTrueAndRoleIn(boxId, ATHLETE_ROLES);
        int coaches = (int) membershipRepository.countByBoxIdAndActiveTrueAndRoleIn(boxId, COACH_ROLES);

        int athleteLimit = plan != null ? plan.getAthleteLimit() : positiveOr(target.getCurrentAthleteLimit(), billingProperties.getDefaults().getAthleteLimit());
        int coachLimit = plan != null ? plan.getCoachLimit() : positiveOr(target.getCurrentCoachLimit(), billingProperties.getDefaults().getCoachLimit());

        int defaultRate = billingProperties.getOverage().getDefaultRate();
        int athleteRate = plan != null && plan.getAthleteOveragePrice() != null ? plan.getAthleteOveragePrice() : defaultRate;
        int coachRate = plan != null && plan.getCoachOveragePrice() != null ? plan.getCoachOveragePrice() : defaultRate;

        int athleteOverage = Math.max(0, athletes - athleteLimit);
        int coachOverage = Math.max(0, coaches - coachLimit);

        return new SubscriptionUsage(
                athletes,
                coaches,
                athleteLimit,
                coachLimit,
                percentage(athletes, athleteLimit),
                percentage(coaches, coachLimit),
                athletes > athleteLimit,
                coaches > coachLimit,
                athleteOverage,
                coachOverage,
                athleteRate,
                coachRate,
                target.isOverageEnabled(),
                target.getNextBillingDate(),
                (long) athleteOverage * athleteRate + (long) coachOverage * coachRate
        );
    }

    @Override
    @Transactional
    public UsageTrackingResult trackEvents(UUID boxId, List<UsageEventRequest> events) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("At least one usage event is required");
        }
        Box box = loadBox(boxId);
        BillingPeriod period = usageEventRecorder.currentBillingPeriod(box);

        EnumSet<UsageEventType> membershipChanges = EnumSet.noneOf(UsageEventType.class);
        for (UsageEventRequest event : events) {
            usageEventRecorder.record(boxId, period, event.eventType(), event.quantity(),
                    event.entityId(), event.userId(), event.billable(), event.metadata());
            if (event.eventType().isMembershipChange()) {
                membershipChanges.add(event.eventType());
            }
        }
        log.debug("Tracked {} usage event(s) for box {} in period {} - {}", events.size(), boxId, period.start(), period.end());

        LimitCheckResult limitCheck = null;
        if (!membershipChanges.isEmpty()) {
            updateBoxUsageCounts(boxId);
            limitCheck = checkLimitsAndTriggerActions(boxId, membershipChanges);
        }
        return new UsageTrackingResult(events.size(), period, limitCheck);
    }

    @Override
    @Transactional
    public Box updateBoxUsageCounts(UUID boxId) {
        Box box = loadBox(boxId);
        box.setCurrentAthleteCount((int) membershipRepository.countByBoxIdAndActiveTrueAndRoleIn(boxId, ATHLETE_ROLES));
        box.setCurrentCoachCount((int) membershipRepository.countByBoxIdAndActiveTrueAndRoleIn(boxId, COACH_ROLES));
        return boxRepository.save(box);
    }

    @Override
    @Transactional
    public LimitCheckResult checkLimitsAndTriggerActions(UUID boxId, Collection<UsageEventType> changes) {
        Box box = loadBox(boxId);
        SubscriptionUsage usage = calculateUsage(boxId);

        boolean athleteApproaching = !usage.isAthleteOverLimit() && usage.athletesPercentage() >= APPROACHING_LIMIT_PERCENT;
        boolean coachApproaching = !usage.isCoachOverLimit() && usage.coachesPercentage() >= APPROACHING_LIMIT_PERCENT;
        if (athleteApproaching) {
            log.info("Box {} is at {}% of its athlete limit ({}/{})", boxId, usage.athletesPercentage(), usage.athletes(), usage.athleteLimit());
        }
        if (coachApproaching) {
            log.info("Box {} is at {}% of its coach limit ({}/{})", boxId, usage.coachesPercentage(), usage.coaches(), usage.coachLimit());
        }

        List<GracePeriodTriggerResult> gracePeriods = new ArrayList<>();
        if (box.isOverageEnabled()) {
            if (usage.hasOverage()) {
                log.info("Box {} is over its limits with overage billing enabled, estimated charge {}",
                        boxId, usage.estimatedOverageAmount());
            }
            return new LimitCheckResult(usage, athleteApproaching, coachApproaching, gracePeriods);
        }

        if (changes.contains(UsageEventType.ATHLETE_ADDED) && usage.isAthleteOverLimit()) {
            gracePeriods.add(gracePeriodService.trigger(boxId, GracePeriodReason.ATHLETE_LIMIT_EXCEEDED,
                    GracePeriodOptions.withContext(limitContext(usage.athletes(), usage.athleteLimit(), usage.athleteOverage()))));
        }
        if (changes.contains(UsageEventType.COACH_ADDED) && usage.isCoachOverLimit()) {
            gracePeriods.add(gracePeriodService.trigger(boxId, GracePeriodReason.COACH_LIMIT_EXCEEDED,
                    GracePeriodOptions.withContext(limitContext(usage.coaches(), usage.coachLimit(), usage.coachOverage()))));
        }
        return new LimitCheckResult(usage, athleteApproaching, coachApproaching, gracePeriods);
    }

    private Box loadBox(UUID boxId) {
        return boxRepository.findById(boxId)
                .orElseThrow(() -> new ResourceNotFoundException("Box " + boxId + " not found"));
    }

    private static Map<String, Object> limitContext(int count, int limit, int overage) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("currentCount", count);
        context.put("limit", limit);
        context.put("overage", overage);
        return context;
    }

    private static int positiveOr(int value, int fallback) {
        return value > 0 ? value : fallback;
    }

    private static int percentage(int count, int limit) {
        if (limit <= 0) {
            return 0;
        }
        return (int) Math.round(count * 100.0 / limit);
    }
}
