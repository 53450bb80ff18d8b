package uk.gegc.boxbilling.features.billing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.boxbilling.features.access.application.AccessControlService;
import uk.gegc.boxbilling.features.access.application.AccessDecision;
import uk.gegc.boxbilling.features.billing.api.dto.ActorRequest;
import uk.gegc.boxbilling.features.billing.api.dto.CancelPlanChangeRequest;
import uk.gegc.boxbilling.features.billing.api.dto.CancelSubscriptionRequest;
import uk.gegc.boxbilling.features.billing.api.dto.CreatePlanChangeRequest;
import uk.gegc.boxbilling.features.billing.api.dto.GracePeriodDto;
import uk.gegc.boxbilling.features.billing.api.dto.OverageEnabledResponse;
import uk.gegc.boxbilling.features.billing.api.dto.PlanChangeDto;
import uk.gegc.boxbilling.features.billing.api.dto.RecalculateRequest;
import uk.gegc.boxbilling.features.billing.api.dto.RecalculateResponse;
import uk.gegc.boxbilling.features.billing.api.dto.ResolveGracePeriodRequest;
import uk.gegc.boxbilling.features.billing.api.dto.SubscriptionChangeDto;
import uk.gegc.boxbilling.features.billing.api.dto.SubscriptionDto;
import uk.gegc.boxbilling.features.billing.api.dto.TaskResult;
import uk.gegc.boxbilling.features.billing.api.dto.TrackUsageRequest;
import uk.gegc.boxbilling.features.billing.application.BillingEventProcessor;
import uk.gegc.boxbilling.features.billing.application.BillingProperties;
import uk.gegc.boxbilling.features.billing.application.RetryDrainSummary;
import uk.gegc.boxbilling.features.graceperiod.application.GracePeriodService;
import uk.gegc.boxbilling.features.subscription.application.EnforcementSummary;
import uk.gegc.boxbilling.features.subscription.application.PlanChangeService;
import uk.gegc.boxbilling.features.subscription.application.SubscriptionEnforcementService;
import uk.gegc.boxbilling.features.subscription.application.SubscriptionLifecycleService;
import uk.gegc.boxbilling.features.subscription.domain.model.ProrationType;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionTier;
import uk.gegc.boxbilling.features.usage.application.OverageBillingResult;
import uk.gegc.boxbilling.features.usage.application.OverageBillingService;
import uk.gegc.boxbilling.features.usage.application.SubscriptionUsage;
import uk.gegc.boxbilling.features.usage.application.UsageTrackingResult;
import uk.gegc.boxbilling.features.usage.application.UsageTrackingService;
import uk.gegc.boxbilling.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/admin/billing")
@RequiredArgsConstructor
@Tag(name = "Billing Admin", description = "Operator triggers for the subscription engine")
public class BillingAdminController {

    static final String TASK_DAILY = "daily";
    static final String TASK_RISK_SCORES = "risk_scores";

    private final SubscriptionEnforcementService enforcementService;
    private final SubscriptionLifecycleService lifecycleService;
    private final BillingEventProcessor billingEventProcessor;
    private final GracePeriodService gracePeriodService;
    private final UsageTrackingService usageTrackingService;
    private final OverageBillingService overageBillingService;
    private final AccessControlService accessControlService;
    private final PlanChangeService planChangeService;
    private final BillingProperties billingProperties;

    @Operation(summary = "Run the reconciliation sweep now",
            description = "Expires lapsed trials and suspends boxes whose canceled subscription has ended.")
    @ApiResponse(responseCode = "200", description = "Sweep finished",
            content = @Content(schema = @Schema(implementation = EnforcementSummary.class)))
    @PostMapping("/reconciliation/run")
    public ResponseEntity<EnforcementSummary> runReconciliation() {
        return ResponseEntity.ok(enforcementService.enforceSubscriptionRules());
    }

    @Operation(summary = "Re-run maintenance tasks for one box",
            description = "'daily' refreshes member counts, re-checks access and calculates overage. Task failures are reported per task.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Tasks ran; see per-task results",
                    content = @Content(schema = @Schema(implementation = RecalculateResponse.class))),
            @ApiResponse(responseCode = "400", description = "No tasks given")
    })
    @PostMapping("/boxes/{boxId}/recalculate")
    public ResponseEntity<RecalculateResponse> recalculate(@PathVariable UUID boxId,
                                                           @Valid @RequestBody RecalculateRequest request) {
        List<TaskResult> results = new ArrayList<>();
        for (String task : request.tasks()) {
            results.add(runTask(boxId, task));
        }
        boolean success = results.stream().noneMatch(r -> r.status() == TaskResult.Status.FAILED);
        return ResponseEntity.ok(new RecalculateResponse(boxId, success, results));
    }

    @Operation(summary = "Retry failed webhook events now")
    @ApiResponse(responseCode = "200", description = "Drain finished",
            content = @Content(schema = @Schema(implementation = RetryDrainSummary.class)))
    @PostMapping("/events/retry")
    public ResponseEntity<RetryDrainSummary> retryFailedEvents() {
        return ResponseEntity.ok(billingEventProcessor.retryFailedEvents());
    }

    @Operation(summary = "Enable overage billing for a box",
            description = "Limit-exceeded grace periods are resolved; members above the limit are billed per unit from now on.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Overage billing enabled"),
            @ApiResponse(responseCode = "404", description = "Box not found")
    })
    @PostMapping("/boxes/{boxId}/overage/enable")
    public ResponseEntity<OverageEnabledResponse> enableOverage(@PathVariable UUID boxId,
                                                                @Valid @RequestBody ActorRequest request) {
        int resolved = gracePeriodService.enableOverageBilling(boxId, request.requestedBy());
        return ResponseEntity.ok(new OverageEnabledResponse(boxId, true, resolved));
    }

    @Operation(summary = "Resolve a grace period manually")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Grace period resolved (or already was)"),
            @ApiResponse(responseCode = "404", description = "Grace period not found")
    })
    @PostMapping("/grace-periods/{gracePeriodId}/resolve")
    public ResponseEntity<GracePeriodDto> resolveGracePeriod(@PathVariable UUID gracePeriodId,
                                                             @Valid @RequestBody ResolveGracePeriodRequest request) {
        return ResponseEntity.ok(GracePeriodDto.from(
                gracePeriodService.resolve(gracePeriodId, request.resolution(), request.resolvedBy(), false)));
    }

    @Operation(summary = "List a box's active grace periods", description = "Soonest ending first.")
    @ApiResponse(responseCode = "200", description = "Active grace periods",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = GracePeriodDto.class))))
    @GetMapping("/boxes/{boxId}/grace-periods")
    public ResponseEntity<List<GracePeriodDto>> activeGracePeriods(@PathVariable UUID boxId) {
        return ResponseEntity.ok(gracePeriodService.getActiveGracePeriods(boxId).stream()
                .map(GracePeriodDto::from)
                .toList());
    }

    @Operation(summary = "Unresolved grace periods ending soon",
            description = "Across all boxes, soonest first. The window defaults to billing.grace-periods.upcoming-days.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Grace periods ending within the window",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = GracePeriodDto.class)))),
            @ApiResponse(responseCode = "400", description = "Negative window")
    })
    @GetMapping("/grace-periods/upcoming")
    public ResponseEntity<List<GracePeriodDto>> upcomingExpirations(@RequestParam(required = false) Integer daysAhead) {
        int days = daysAhead != null ? daysAhead : billingProperties.getGracePeriods().getUpcomingDays();
        return ResponseEntity.ok(gracePeriodService.getUpcomingExpirations(days).stream()
                .map(GracePeriodDto::from)
                .toList());
    }

    @Operation(summary = "Current usage against plan limits")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Usage snapshot",
                    content = @Content(schema = @Schema(implementation = SubscriptionUsage.class))),
            @ApiResponse(responseCode = "404", description = "Box not found")
    })
    @GetMapping("/boxes/{boxId}/usage")
    public ResponseEntity<SubscriptionUsage> usage(@PathVariable UUID boxId) {
        return ResponseEntity.ok(usageTrackingService.calculateUsage(boxId));
    }

    @Operation(summary = "Record usage events for a box",
            description = "Membership changes refresh the box counts and may open a limit grace period.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Events recorded",
                    content = @Content(schema = @Schema(implementation = UsageTrackingResult.class))),
            @ApiResponse(responseCode = "400", description = "No events or invalid event"),
            @ApiResponse(responseCode = "404", description = "Box not found")
    })
    @PostMapping("/boxes/{boxId}/usage/events")
    public ResponseEntity<UsageTrackingResult> trackUsage(@PathVariable UUID boxId,
                                                          @Valid @RequestBody TrackUsageRequest request) {
        return ResponseEntity.ok(usageTrackingService.trackEvents(boxId, request.events()));
    }

    @Operation(summary = "Cancel a box's subscription", description = "At period end by default.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Subscription canceled or scheduled to cancel"),
            @ApiResponse(responseCode = "404", description = "Box or subscription not found"),
            @ApiResponse(responseCode = "409", description = "Subscription already canceled")
    })
    @PostMapping("/boxes/{boxId}/subscription/cancel")
    public ResponseEntity<SubscriptionDto> cancelSubscription(@PathVariable UUID boxId,
                                                              @Valid @RequestBody CancelSubscriptionRequest request) {
        return ResponseEntity.ok(SubscriptionDto.from(lifecycleService.cancelSubscription(
                boxId, request.atPeriodEnd(), request.reason(), request.requestedBy())));
    }

    @Operation(summary = "Undo a cancellation while the paid period is still running")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Subscription active again"),
            @ApiResponse(responseCode = "404", description = "Box or subscription not found"),
            @ApiResponse(responseCode = "409", description = "Not canceled, or the period has ended")
    })
    @PostMapping("/boxes/{boxId}/subscription/reactivate")
    public ResponseEntity<SubscriptionDto> reactivateSubscription(@PathVariable UUID boxId,
                                                                  @Valid @RequestBody ActorRequest request) {
        return ResponseEntity.ok(SubscriptionDto.from(lifecycleService.reactivateSubscription(boxId, request.requestedBy())));
    }

    @Operation(summary = "Subscription history of a box", description = "Most recent change first.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Recorded subscription changes",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = SubscriptionChangeDto.class)))),
            @ApiResponse(responseCode = "400", description = "limit outside 1..100"),
            @ApiResponse(responseCode = "404", description = "Box not found")
    })
    @GetMapping("/boxes/{boxId}/subscription/history")
    public ResponseEntity<List<SubscriptionChangeDto>> subscriptionHistory(@PathVariable UUID boxId,
                                                                           @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(lifecycleService.getSubscriptionHistory(boxId, limit).stream()
                .map(SubscriptionChangeDto::from)
                .toList());
    }

    @Operation(summary = "Request a plan change", description = "Recorded as pending until approved.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Plan change requested"),
            @ApiResponse(responseCode = "400", description = "Unknown tier or proration type"),
            @ApiResponse(responseCode = "404", description = "Box or target plan not found"),
            @ApiResponse(responseCode = "409", description = "No active subscription, same tier, or a request already pending")
    })
    @PostMapping("/boxes/{boxId}/plan-changes")
    public ResponseEntity<PlanChangeDto> requestPlanChange(@PathVariable UUID boxId,
                                                           @Valid @RequestBody CreatePlanChangeRequest request) {
        SubscriptionTier tier = SubscriptionTier.fromValue(request.toTier())
                .orElseThrow(() -> new ValidationException("Unknown tier '" + request.toTier() + "'"));
        ProrationType prorationType = request.prorationType() == null ? null
                : ProrationType.fromValue(request.prorationType())
                .orElseThrow(() -> new ValidationException("Unknown proration type '" + request.prorationType() + "'"));
        return ResponseEntity.status(HttpStatus.CREATED).body(PlanChangeDto.from(planChangeService.requestPlanChange(
                boxId, tier, prorationType, request.effectiveDate(), request.requestedBy())));
    }

    @Operation(summary = "Pending plan changes of a box", description = "Newest first.")
    @ApiResponse(responseCode = "200", description = "Pending requests",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = PlanChangeDto.class))))
    @GetMapping("/boxes/{boxId}/plan-changes")
    public ResponseEntity<List<PlanChangeDto>> pendingPlanChanges(@PathVariable UUID boxId) {
        return ResponseEntity.ok(planChangeService.getPendingPlanChanges(boxId).stream()
                .map(PlanChangeDto::from)
                .toList());
    }

    @Operation(summary = "Approve a plan change",
            description = "Moves the subscription to the new plan, updates the box limits and stores the prorated amount.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Plan change applied"),
            @ApiResponse(responseCode = "404", description = "Plan change not found"),
            @ApiResponse(responseCode = "409", description = "Not pending, or the subscription is no longer active")
    })
    @PostMapping("/plan-changes/{requestId}/approve")
    public ResponseEntity<PlanChangeDto> approvePlanChange(@PathVariable UUID requestId,
                                                           @Valid @RequestBody ActorRequest request) {
        return ResponseEntity.ok(PlanChangeDto.from(planChangeService.approvePlanChange(requestId, request.requestedBy())));
    }

    @Operation(summary = "Cancel a pending plan change")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Plan change canceled"),
            @ApiResponse(responseCode = "404", description = "Plan change not found"),
            @ApiResponse(responseCode = "409", description = "Not pending")
    })
    @PostMapping("/plan-changes/{requestId}/cancel")
    public ResponseEntity<PlanChangeDto> cancelPlanChange(@PathVariable UUID requestId,
                                                          @Valid @RequestBody CancelPlanChangeRequest request) {
        return ResponseEntity.ok(PlanChangeDto.from(
                planChangeService.cancelPlanChange(requestId, request.requestedBy(), request.reason())));
    }

    private TaskResult runTask(UUID boxId, String task) {
        if (TASK_RISK_SCORES.equals(task)) {
            return TaskResult.skipped(task, "Risk scoring is not part of the billing engine");
        }
        if (!TASK_DAILY.equals(task)) {
            return TaskResult.failed(task, "Unknown task");
        }
        try {
            usageTrackingService.updateBoxUsageCounts(boxId);
            AccessDecision access = accessControlService.checkAccess(boxId);
            OverageBillingResult overage = overageBillingService.calculateOverageBilling(boxId);
            String message = String.format("access=%s%s, overage=%d",
                    access.hasAccess(),
                    access.hasAccess() ? "" : " (" + access.reason() + ")",
                    overage.overageAmount());
            return TaskResult.completed(task, message);
        } catch (RuntimeException e) {
            log.warn("Task {} failed for box {}: {}", task, boxId, e.getMessage(), e);
            return TaskResult.failed(task, e.getMessage());
        }
    }
}
