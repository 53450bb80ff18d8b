package uk.gegc.boxbilling.features.graceperiod.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.boxbilling.features.billing.application.BillingMetricsService;
import uk.gegc.boxbilling.features.billing.application.BillingNotificationService;
import uk.gegc.boxbilling.features.box.domain.model.Box;
import uk.gegc.boxbilling.features.box.infra.repository.BoxRepository;
import uk.gegc.boxbilling.features.graceperiod.application.GracePeriodOptions;
import uk.gegc.boxbilling.features.graceperiod.application.GracePeriodService;
import uk.gegc.boxbilling.features.graceperiod.application.GracePeriodTriggerResult;
import uk.gegc.boxbilling.features.graceperiod.domain.model.GracePeriod;
import uk.gegc.boxbilling.features.graceperiod.domain.model.GracePeriodReason;
import uk.gegc.boxbilling.features.graceperiod.domain.model.GracePeriodResolution;
import uk.gegc.boxbilling.features.graceperiod.infra.repository.GracePeriodRepository;
import uk.gegc.boxbilling.features.usage.application.UsageEventRecorder;
import uk.gegc.boxbilling.features.usage.domain.model.UsageEventType;
import uk.gegc.boxbilling.shared.exception.ResourceNotFoundException;
import uk.gegc.boxbilling.shared.util.RequiresNewTransactions;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class GracePeriodServiceImpl implements GracePeriodService {

    private static final EnumSet<GracePeriodReason> LIMIT_REASONS =
            EnumSet.of(GracePeriodReason.ATHLETE_LIMIT_EXCEEDED, GracePeriodReason.COACH_LIMIT_EXCEEDED);

    private final GracePeriodRepository gracePeriodRepository;
    private final BoxRepository boxRepository;
    private final UsageEventRecorder usageEventRecorder;
    private final BillingNotificationService notificationService;
    private final BillingMetricsService metricsService;
    private final RequiresNewTransactions requiresNew;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional
    public GracePeriodTriggerResult trigger(UUID boxId, GracePeriodReason reason, GracePeriodOptions options) {
        GracePeriodOptions opts = options == null ? GracePeriodOptions.defaults() : options;
        Instant now = Instant.now(clock);

        Optional<GracePeriod> open = gracePeriodRepository
                .findFirstByBoxIdAndReasonAndResolvedFalseAndEndsAtGreaterThanEqual(boxId, reason, now);
        if (open.isPresent()) {
            log.info("Grace period {} already open for box {} ({})", open.get().getId(), boxId, reason.getValue());
            return new GracePeriodTriggerResult(open.get(), true);
        }

        String dedupKey = GracePeriod.dedupKey(boxId, reason);
        GracePeriodTriggerResult result;
        try {
            result = requiresNew.call(() -> insertOrReuse(boxId, reason, opts, dedupKey, now));
        } catch (DataIntegrityViolationException e) {
            if (!RequiresNewTransactions.isDuplicateKey(e)) {
                throw e;
            }
            log.info("Concurrent grace period insert for box {} ({}), re-reading", boxId, reason.getValue());
            GracePeriod winner = requiresNew.call(() -> gracePeriodRepository.findByOpenDedupKey(dedupKey))
                    .orElseThrow(() -> e);
            return new GracePeriodTriggerResult(winner, true);
        }

        if (result.wasExisting()) {
            return result;
        }

        GracePeriod created = result.gracePeriod();
        metricsService.incrementGracePeriodTriggered(reason.getValue());
        log.info("Opened grace period {} for box {} ({}, {}) until {}",
                created.getId(), boxId, reason.getValue(), created.getSeverity(), created.getEndsAt());
        notifySafely(() -> notificationService.gracePeriodStarted(created), created);
        return result;
    }

    /**
     * Runs in its own transaction. A row still holding the dedup key is either still open (another
     * trigger won between our check and now) or past its end date, in which case it is closed as expired
     * so the key can be reused. The audit event commits with the new row.
     */
    private GracePeriodTriggerResult insertOrReuse(UUID boxId, GracePeriodReason reason, GracePeriodOptions opts,
                                                   String dedupKey, Instant now) {
        Optional<GracePeriod> holder = gracePeriodRepository.findByOpenDedupKey(dedupKey);
        if (holder.isPresent()) {
            GracePeriod existing = holder.get();
            if (existing.isActiveAt(now)) {
                return new GracePeriodTriggerResult(existing, true);
            }
            markResolved(existing, GracePeriodResolution.EXPIRED, GracePeriodResolution.SYSTEM_ACTOR, true, now);
            gracePeriodRepository.saveAndFlush(existing);
            log.info("Closed expired grace period {} for box {} ({})", existing.getId(), boxId, reason.getValue());
        }

        GracePeriod gracePeriod = new GracePeriod();
        gracePeriod.setBoxId(boxId);
        gracePeriod.setReason(reason);
        gracePeriod.setSeverity(opts.severity() != null ? opts.severity() : reason.getDefaultSeverity());
        gracePeriod.setAutoResolve(opts.autoResolve() == null || opts.autoResolve());
        gracePeriod.setEndsAt(now.plus(reason.getDuration()));
        gracePeriod.setContextSnapshot(toJson(opts.contextSnapshot()));
        gracePeriod.setOpenDedupKey(dedupKey);
        gracePeriod.setCreatedAt(now);
        GracePeriod created = gracePeriodRepository.saveAndFlush(gracePeriod);
        boxRepository.findById(boxId).ifPresent(box -> usageEventRecorder.record(box,
                UsageEventType.GRACE_PERIOD_TRIGGERED,
                Map.of("gracePeriodId", created.getId().toString(),
                        "reason", reason.getValue(),
                        "severity", created.getSeverity().name().toLowerCase(),
                        "endsAt", created.getEndsAt().toString())));
        return new GracePeriodTriggerResult(created, false);
    }

    @Override
    @Transactional
    public GracePeriod resolve(UUID gracePeriodId, String resolution, String resolvedBy, boolean autoResolved) {
        GracePeriod gracePeriod = gracePeriodRepository.findById(gracePeriodId)
                .orElseThrow(() -> new ResourceNotFoundException("Grace period " + gracePeriodId + " not found"));
        if (gracePeriod.isResolved()) {
            return gracePeriod;
        }
        markResolved(gracePeriod, resolution, resolvedBy, autoResolved, Instant.now(clock));
        GracePeriod saved = gracePeriodRepository.save(gracePeriod);
        afterResolve(saved);
        return saved;
    }

    @Override
    @Transactional
    public int resolveForReasons(UUID boxId, Collection<GracePeriodReason> reasons, String resolution,
                                 String resolvedBy, boolean autoResolved) {
        if (reasons == null || reasons.isEmpty()) {
            return 0;
        }
        Instant now = Instant.now(clock);
        List<GracePeriod> open = gracePeriodRepository.findByBoxIdAndResolvedFalseAndReasonIn(boxId, reasons);
        for (GracePeriod gracePeriod : open) {
            markResolved(gracePeriod, resolution, resolvedBy, autoResolved, now);
            afterResolve(gracePeriodRepository.save(gracePeriod));
        }
        if (!open.isEmpty()) {
            log.info("Resolved {} grace period(s) for box {} with resolution '{}'", open.size(), boxId, resolution);
        }
        return open.size();
    }

    @Override
    @Transactional(readOnly = true)
    public List<GracePeriod> getActiveGracePeriods(UUID boxId) {
        return gracePeriodRepository.findByBoxIdAndResolvedFalseAndEndsAtGreaterThanEqualOrderByEndsAtAsc(
                boxId, Instant.now(clock));
    }

    @Override
    @Transactional(readOnly = true)
    public List<GracePeriod> getUpcomingExpirations(int daysAhead) {
        if (daysAhead < 0) {
            throw new IllegalArgumentException("daysAhead must not be negative");
        }
        Instant now = Instant.now(clock);
        return gracePeriodRepository.findByResolvedFalseAndEndsAtBetweenOrderByEndsAtAsc(
                now, now.plus(Duration.ofDays(daysAhead)));
    }

    @Override
    @Transactional
    public int enableOverageBilling(UUID boxId, String userId) {
        Box box = boxRepository.findById(boxId)
                .orElseThrow(() -> new ResourceNotFoundException("Box " + boxId + " not found"));
        if (!box.isOverageEnabled()) {
            box.setOverageEnabled(true);
            boxRepository.save(box);
            usageEventRecorder.record(box, UsageEventType.OVERAGE_ENABLED,
                    userId == null ? Map.<String, Object>of() : Map.<String, Object>of("enabledBy", userId));
            log.info("Overage billing enabled for box {} by {}", boxId, userId);
        }
        return resolveForReasons(boxId, LIMIT_REASONS, GracePeriodResolution.OVERAGE_ENABLED, userId, false);
    }

    private void markResolved(GracePeriod gracePeriod, String resolution, String resolvedBy,
                              boolean autoResolved, Instant now) {
        gracePeriod.setResolved(true);
        gracePeriod.setResolvedAt(now);
        gracePeriod.setResolution(resolution);
        gracePeriod.setResolvedBy(resolvedBy);
        gracePeriod.setAutoResolved(autoResolved);
        gracePeriod.setOpenDedupKey(null);
    }

    private void afterResolve(GracePeriod gracePeriod) {
        boxRepository.findById(gracePeriod.getBoxId()).ifPresent(box -> usageEventRecorder.record(box,
                UsageEventType.GRACE_PERIOD_RESOLVED,
                Map.of("gracePeriodId", gracePeriod.getId().toString(),
                        "reason", gracePeriod.getReason().getValue(),
                        "resolution", String.valueOf(gracePeriod.getResolution()),
                        "autoResolved", gracePeriod.isAutoResolved())));
        metricsService.incrementGracePeriodResolved(gracePeriod.getReason().getValue());
        notifySafely(() -> notificationService.gracePeriodResolved(gracePeriod), gracePeriod);
    }

    private void notifySafely(Runnable notification, GracePeriod gracePeriod) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            log.warn("Notification for grace period {} failed: {}", gracePeriod.getId(), e.getMessage());
        }
    }

    private String toJson(Map<String, Object> contextSnapshot) {
        if (contextSnapshot == null || contextSnapshot.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(contextSnapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Grace period context is not serializable", e);
        }
    }
}
