package uk.gegc.boxbilling.features.subscription.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.boxbilling.features.box.infra.repository.BoxRepository;
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
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlanChangeServiceImplTest {

    private static final Instant PERIOD_START = Instant.parse("2025-03-01T00:00:00Z");
    private static final Instant PERIOD_END = Instant.parse("2025-03-31T00:00:00Z");
    // 10 of 30 days left
    private static final Instant NOW = Instant.parse("2025-03-21T00:00:00Z");

    @Mock
    private PlanChangeRequestRepository requestRepository;
    @Mock
    private SubscriptionRepository subscriptionRepository;
    @Mock
    private SubscriptionPlanRepository planRepository;
    @Mock
    private BoxRepository boxRepository;
    @Mock
    private SubscriptionLifecycleService lifecycleService;

    private PlanChangeServiceImpl service;
    private UUID boxId;
    private SubscriptionPlan grow;
    private SubscriptionPlan scale;
    private Subscription subscription;

    @BeforeEach
    void setUp() {
        service = new PlanChangeServiceImpl(requestRepository, subscriptionRepository, planRepository, boxRepository,
                lifecycleService, Clock.fixed(NOW, ZoneOffset.UTC));
        boxId = UUID.randomUUID();
        grow = plan(SubscriptionTier.GROW, 9900L);
        scale = plan(SubscriptionTier.SCALE, 24900L);

        subscription = new Subscription();
        subscription.setId(UUID.randomUUID());
        subscription.setBoxId(boxId);
        subscription.setProviderSubscriptionId("sub_1");
        subscription.setStatus(SubscriptionStatus.ACTIVE);
        subscription.setPlanId(grow.getId());
        subscription.setPlanTier(SubscriptionTier.GROW);
        subscription.setCurrentPeriodStart(PERIOD_START);
        subscription.setCurrentPeriodEnd(PERIOD_END);

        lenient().when(boxRepository.existsById(boxId)).thenReturn(true);
        lenient().when(subscriptionRepository.findFirstByBoxIdAndStatusOrderByCurrentPeriodStartDesc(boxId, SubscriptionStatus.ACTIVE))
                .thenReturn(Optional.of(subscription));
        lenient().when(subscriptionRepository.findById(subscription.getId())).thenReturn(Optional.of(subscription));
        lenient().when(planRepository.findById(grow.getId())).thenReturn(Optional.of(grow));
        lenient().when(planRepository.findById(scale.getId())).thenReturn(Optional.of(scale));
        lenient().when(planRepository.findByTierAndCurrentVersionTrue(SubscriptionTier.GROW)).thenReturn(Optional.of(grow));
        lenient().when(planRepository.findByTierAndCurrentVersionTrue(SubscriptionTier.SCALE)).thenReturn(Optional.of(scale));
        lenient().when(requestRepository.save(any(PlanChangeRequest.class))).thenAnswer(inv -> {
            PlanChangeRequest request = inv.getArgument(0);
            if (request.getId() == null) {
                request.setId(UUID.randomUUID());
            }
            return request;
        });
    }

    private static SubscriptionPlan plan(SubscriptionTier tier, long monthlyPrice) {
        SubscriptionPlan plan = new SubscriptionPlan();
        plan.setId(UUID.randomUUID());
        plan.setTier(tier);
        plan.setMonthlyPrice(monthlyPrice);
        return plan;
    }

    private PlanChangeRequest pending(ProrationType prorationType) {
        PlanChangeRequest request = new PlanChangeRequest();
        request.setId(UUID.randomUUID());
        request.setBoxId(boxId);
        request.setSubscriptionId(subscription.getId());
        request.setFromPlanId(grow.getId());
        request.setToPlanId(scale.getId());
        request.setFromTier(SubscriptionTier.GROW);
        request.setToTier(SubscriptionTier.SCALE);
        request.setDirection(PlanChangeDirection.UPGRADE);
        request.setProrationType(prorationType);
        request.setStatus(PlanChangeStatus.PENDING);
        request.setRequestedBy("owner-1");
        when(requestRepository.findById(request.getId())).thenReturn(Optional.of(request));
        return request;
    }

    @Nested
    @DisplayName("requestPlanChange")
    class RequestTests {

        @Test
        @DisplayName("Records a pending upgrade from the active plan")
        void request_recordsPendingUpgrade() {
            PlanChangeRequest request = service.requestPlanChange(boxId, SubscriptionTier.SCALE, null, null, "owner-1");

            assertThat(request.getStatus()).isEqualTo(PlanChangeStatus.PENDING);
            assertThat(request.getDirection()).isEqualTo(PlanChangeDirection.UPGRADE);
            assertThat(request.getProrationType()).isEqualTo(ProrationType.IMMEDIATE);
            assertThat(request.getFromPlanId()).isEqualTo(grow.getId());
            assertThat(request.getToPlanId()).isEqualTo(scale.getId());
            assertThat(request.getRequestedEffectiveDate()).isEqualTo(NOW);
            assertThat(request.getCreatedAt()).isEqualTo(NOW);
            verify(lifecycleService, never()).applyPlanChange(any(), any(), any(), any());
        }

        @Test
        @DisplayName("Moving to a cheaper plan is a downgrade")
        void request_cheaperPlan_isDowngrade() {
            subscription.setPlanId(scale.getId());
            subscription.setPlanTier(SubscriptionTier.SCALE);

            PlanChangeRequest request = service.requestPlanChange(boxId, SubscriptionTier.GROW,
                    ProrationType.END_OF_PERIOD, PERIOD_END, "owner-1");

            assertThat(request.getDirection()).isEqualTo(PlanChangeDirection.DOWNGRADE);
            assertThat(request.getRequestedEffectiveDate()).isEqualTo(PERIOD_END);
        }

        @Test
        @DisplayName("Same tier, second pending request and missing subscription are rejected")
        void request_invalidStates_throw() {
            assertThatThrownBy(() -> service.requestPlanChange(boxId, SubscriptionTier.GROW, null, null, "owner-1"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("already on");

            when(requestRepository.existsByBoxIdAndStatus(boxId, PlanChangeStatus.PENDING)).thenReturn(true);
            assertThatThrownBy(() -> service.requestPlanChange(boxId, SubscriptionTier.SCALE, null, null, "owner-1"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("pending");

            when(subscriptionRepository.findFirstByBoxIdAndStatusOrderByCurrentPeriodStartDesc(boxId, SubscriptionStatus.ACTIVE))
                    .thenReturn(Optional.empty());
            assertThatThrownBy(() -> service.requestPlanChange(boxId, SubscriptionTier.SCALE, null, null, "owner-1"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("no active subscription");
            verify(requestRepository, never()).save(any());
        }

        @Test
        @DisplayName("Unknown box is not found")
        void request_unknownBox_throws() {
            UUID unknown = UUID.randomUUID();

            assertThatThrownBy(() -> service.requestPlanChange(unknown, SubscriptionTier.SCALE, null, null, "owner-1"))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("approvePlanChange")
    class ApproveTests {

        @Test
        @DisplayName("Immediate change charges the price difference for the days left")
        void approve_immediate_prorates() {
            subscription.setAmount(9900L);
            PlanChangeRequest request = pending(ProrationType.IMMEDIATE);

            PlanChangeRequest approved = service.approvePlanChange(request.getId(), "ops-1");

            // (24900 - 9900) * 10 / 30
            assertThat(approved.getProratedAmount()).isEqualTo(5000L);
            assertThat(approved.getStatus()).isEqualTo(PlanChangeStatus.APPROVED);
            assertThat(approved.getApprovedBy()).isEqualTo("ops-1");
            assertThat(approved.getApprovedAt()).isEqualTo(NOW);
            verify(lifecycleService).applyPlanChange(boxId, scale, PlanChangeServiceImpl.PLAN_CHANGE_REASON, "ops-1");
        }

        @Test
        @DisplayName("Changes settled on a later invoice are not prorated")
        void approve_deferred_noProration() {
            PlanChangeRequest request = pending(ProrationType.NEXT_BILLING_CYCLE);

            assertThat(service.approvePlanChange(request.getId(), "ops-1").getProratedAmount()).isZero();
            verify(lifecycleService).applyPlanChange(eq(boxId), eq(scale), anyString(), eq("ops-1"));
        }

        @Test
        @DisplayName("Only pending requests for an active subscription can be approved")
        void approve_invalidStates_throw() {
            PlanChangeRequest canceled = pending(ProrationType.IMMEDIATE);
            canceled.setStatus(PlanChangeStatus.CANCELED);
            assertThatThrownBy(() -> service.approvePlanChange(canceled.getId(), "ops-1"))
                    .isInstanceOf(IllegalStateException.class);

            PlanChangeRequest stale = pending(ProrationType.IMMEDIATE);
            subscription.setStatus(SubscriptionStatus.CANCELED);
            assertThatThrownBy(() -> service.approvePlanChange(stale.getId(), "ops-1"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("no longer active");

            assertThat(stale.getStatus()).isEqualTo(PlanChangeStatus.PENDING);
            verify(lifecycleService, never()).applyPlanChange(any(), any(), any(), any());
        }

        @Test
        @DisplayName("Proration never covers more than the whole period and is zero after it")
        void prorate_bounds() {
            Instant beforePeriod = PERIOD_START.minusSeconds(86_400 * 5);
            assertThat(PlanChangeServiceImpl.prorate(subscription, 9900L, 24900L, ProrationType.IMMEDIATE, beforePeriod))
                    .isEqualTo(15000L);
            assertThat(PlanChangeServiceImpl.prorate(subscription, 24900L, 9900L, ProrationType.IMMEDIATE, NOW))
                    .isEqualTo(-5000L);
            assertThat(PlanChangeServiceImpl.prorate(subscription, 9900L, 24900L, ProrationType.IMMEDIATE,
                    PERIOD_END.plusSeconds(60))).isZero();
        }
    }

    @Nested
    @DisplayName("cancelPlanChange")
    class CancelTests {

        @Test
        @DisplayName("Pending request is canceled with the reason")
        void cancel_pending() {
            PlanChangeRequest request = pending(ProrationType.IMMEDIATE);

            PlanChangeRequest canceled = service.cancelPlanChange(request.getId(), "owner-1", "changed my mind");

            assertThat(canceled.getStatus()).isEqualTo(PlanChangeStatus.CANCELED);
            assertThat(canceled.getCanceledBy()).isEqualTo("owner-1");
            assertThat(canceled.getCancelReason()).isEqualTo("changed my mind");
        }

        @Test
        @DisplayName("Approved request cannot be canceled")
        void cancel_approved_throws() {
            PlanChangeRequest request = pending(ProrationType.IMMEDIATE);
            request.setStatus(PlanChangeStatus.APPROVED);

            assertThatThrownBy(() -> service.cancelPlanChange(request.getId(), "owner-1", null))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Unknown request is not found")
        void cancel_unknown_throws() {
            UUID unknown = UUID.randomUUID();
            when(requestRepository.findById(unknown)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.cancelPlanChange(unknown, "owner-1", null))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }
}
