package uk.gegc.boxbilling.features.usage.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
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
import uk.gegc.boxbilling.features.usage.application.OverageRunSummary;
import uk.gegc.boxbilling.features.usage.application.SubscriptionUsage;
import uk.gegc.boxbilling.features.usage.application.UsageEventRecorder;
import uk.gegc.boxbilling.features.usage.application.UsageTrackingService;
import uk.gegc.boxbilling.features.usage.domain.model.OverageBillingRecord;
import uk.gegc.boxbilling.features.usage.domain.model.OverageBillingStatus;
import uk.gegc.boxbilling.features.usage.domain.model.UsageEventType;
import uk.gegc.boxbilling.features.usage.infra.repository.OverageBillingRecordRepository;
import uk.gegc.boxbilling.shared.util.RequiresNewTransactions;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OverageBillingServiceImplTest {

    private static final Instant NOW = Instant.parse("2025-04-01T02:00:00Z");
    private static final Instant PERIOD_START = Instant.parse("2025-03-01T00:00:00Z");
    private static final Instant PERIOD_END = Instant.parse("2025-04-01T00:00:00Z");

    @Mock
    private BoxRepository boxRepository;
    @Mock
    private SubscriptionRepository subscriptionRepository;
    @Mock
    private SubscriptionPlanRepository planRepository;
    @Mock
    private OverageBillingRecordRepository overageRepository;
    @Mock
    private UsageTrackingService usageTrackingService;
    @Mock
    private UsageEventRecorder usageEventRecorder;
    @Mock
    private BillingNotificationService notificationService;
    @Mock
    private BillingMetricsService metricsService;

    private OverageBillingServiceImpl service;
    private Box box;
    private Subscription subscription;
    private SubscriptionPlan plan;

    @BeforeEach
    void setUp() {
        service = new OverageBillingServiceImpl(
                boxRepository,
                subscriptionRepository,
                planRepository,
                overageRepository,
                usageTrackingService,
                usageEventRecorder,
                notificationService,
                metricsService,
                new RequiresNewTransactions(),
                Clock.fixed(NOW, ZoneOffset.UTC)
        );

        box = box(true);
        plan = new SubscriptionPlan();
        plan.setId(UUID.randomUUID());
        plan.setAthleteLimit(75);
        plan.setCoachLimit(3);

        subscription = new Subscription();
        subscription.setId(UUID.randomUUID());
        subscription.setBoxId(box.getId());
        subscription.setPlanId(plan.getId());
        subscription.setStatus(SubscriptionStatus.ACTIVE);
        subscription.setCurrentPeriodStart(PERIOD_START);
        subscription.setCurrentPeriodEnd(PERIOD_END);

        lenient().when(subscriptionRepository.findFirstByBoxIdAndStatusOrderByCurrentPeriodStartDesc(box.getId(), SubscriptionStatus.ACTIVE))
                .thenReturn(Optional.of(subscription));
        lenient().when(subscriptionRepository.findById(subscription.getId())).thenReturn(Optional.of(subscription));
        lenient().when(planRepository.findById(plan.getId())).thenReturn(Optional.of(plan));
    }

    private Box box(boolean overageEnabled) {
        Box created = new Box();
        created.setId(UUID.randomUUID());
        created.setName("Box " + created.getId());
        created.setOverageEnabled(overageEnabled);
        lenient().when(boxRepository.findById(created.getId())).thenReturn(Optional.of(created));
        return created;
    }

    private static SubscriptionUsage usage(int athletes, int coaches) {
        int athleteOverage = Math.max(0, athletes - 75);
        int coachOverage = Math.max(0, coaches - 3);
        return new SubscriptionUsage(athletes, coaches, 75, 3,
                Math.round(athletes * 100f / 75), Math.round(coaches * 100f / 3),
                athleteOverage > 0, coachOverage > 0, athleteOverage, coachOverage, 100, 100,
                true, PERIOD_END, athleteOverage * 100L + coachOverage * 100L);
    }

    @Nested
    @DisplayName("calculateOverageBilling")
    class CalculateTests {

        @Test
        @DisplayName("Creates one record for 5 extra athletes at 100 each")
        void overLimit_createsRecord() {
            when(overageRepository.findByBoxIdAndBillingPeriodStartAndBillingPeriodEnd(box.getId(), PERIOD_START, PERIOD_END))
                    .thenReturn(Optional.empty());
            when(usageTrackingService.calculateUsage(box.getId(), plan, box)).thenReturn(usage(80, 3));
            when(overageRepository.saveAndFlush(any(OverageBillingRecord.class))).thenAnswer(inv -> {
                OverageBillingRecord record = inv.getArgument(0);
                record.setId(UUID.randomUUID());
                return record;
            });

            OverageBillingResult result = service.calculateOverageBilling(box.getId());

            assertThat(result.created()).isTrue();
            OverageBillingRecord record = result.record();
            assertThat(record.getAthleteOverage()).isEqualTo(5);
            assertThat(record.getCoachOverage()).isZero();
            assertThat(record.getAthleteOverageAmount()).isEqualTo(500L);
            assertThat(record.getTotalOverageAmount()).isEqualTo(500L);
            assertThat(record.getBillingPeriodStart()).isEqualTo(PERIOD_START);
            assertThat(record.getBillingPeriodEnd()).isEqualTo(PERIOD_END);
            assertThat(record.getStatus()).isEqualTo(OverageBillingStatus.CALCULATED);
            assertThat(result.overageAmount()).isEqualTo(500L);
            verify(metricsService).incrementOverageRecordCreated();
            verify(usageEventRecorder).record(eq(box), eq(UsageEventType.OVERAGE_CALCULATED), anyMap());
            verify(notificationService).overageCalculated(record);
        }

        @Test
        @DisplayName("Second run in the same period returns the stored record")
        void samePeriod_returnsExisting() {
            OverageBillingRecord stored = new OverageBillingRecord();
            stored.setId(UUID.randomUUID());
            stored.setTotalOverageAmount(500L);
            when(overageRepository.findByBoxIdAndBillingPeriodStartAndBillingPeriodEnd(box.getId(), PERIOD_START, PERIOD_END))
                    .thenReturn(Optional.of(stored));

            OverageBillingResult result = service.calculateOverageBilling(box.getId());

            assertThat(result.created()).isFalse();
            assertThat(result.record()).isSameAs(stored);
            assertThat(result.overageAmount()).isEqualTo(500L);
            verify(overageRepository, never()).saveAndFlush(any());
            verify(metricsService, never()).incrementOverageRecordCreated();
        }

        @Test
        @DisplayName("Losing a concurrent insert returns the winner")
        void concurrentInsert_returnsWinner() {
            OverageBillingRecord winner = new OverageBillingRecord();
            winner.setId(UUID.randomUUID());
            when(overageRepository.findByBoxIdAndBillingPeriodStartAndBillingPeriodEnd(box.getId(), PERIOD_START, PERIOD_END))
                    .thenReturn(Optional.empty(), Optional.of(winner));
            when(usageTrackingService.calculateUsage(box.getId(), plan, box)).thenReturn(usage(80, 3));
            doThrow(new DataIntegrityViolationException("Duplicate entry for key 'uk_overage_billing_period'"))
                    .when(overageRepository).saveAndFlush(any(OverageBillingRecord.class));

            OverageBillingResult result = service.calculateOverageBilling(box.getId());

            assertThat(result.created()).isFalse();
            assertThat(result.record()).isSameAs(winner);
        }

        @Test
        @DisplayName("Overage disabled gives zero")
        void overageDisabled_none() {
            Box disabled = box(false);

            OverageBillingResult result = service.calculateOverageBilling(disabled.getId());

            assertThat(result.hasRecord()).isFalse();
            assertThat(result.overageAmount()).isZero();
            assertThat(result.reason()).isEqualTo("Overage billing not enabled");
        }

        @Test
        @DisplayName("No active subscription gives zero")
        void noSubscription_none() {
            Box other = box(true);
            when(subscriptionRepository.findFirstByBoxIdAndStatusOrderByCurrentPeriodStartDesc(other.getId(), SubscriptionStatus.ACTIVE))
                    .thenReturn(Optional.empty());

            OverageBillingResult result = service.calculateOverageBilling(other.getId());

            assertThat(result.overageAmount()).isZero();
            assertThat(result.reason()).isEqualTo("No active subscription");
        }

        @Test
        @DisplayName("Within limits gives zero and stores nothing")
        void withinLimits_none() {
            when(overageRepository.findByBoxIdAndBillingPeriodStartAndBillingPeriodEnd(any(), any(), any()))
                    .thenReturn(Optional.empty());
            when(usageTrackingService.calculateUsage(box.getId(), plan, box)).thenReturn(usage(70, 2));

            OverageBillingResult result = service.calculateOverageBilling(box.getId());

            assertThat(result.hasRecord()).isFalse();
            verify(overageRepository, never()).saveAndFlush(any());
        }
    }

    @Nested
    @DisplayName("processPeriodOverageBilling")
    class RunTests {

        @Test
        @DisplayName("A failing box is counted and does not stop the run")
        void failingBox_isolated() {
            Box broken = box(true);
            when(boxRepository.findByOverageEnabledTrueAndStatus(BoxStatus.ACTIVE)).thenReturn(List.of(broken, box));
            when(subscriptionRepository.findFirstByBoxIdAndStatusOrderByCurrentPeriodStartDesc(broken.getId(), SubscriptionStatus.ACTIVE))
                    .thenThrow(new IllegalStateException("connection reset"));
            when(overageRepository.findByBoxIdAndBillingPeriodStartAndBillingPeriodEnd(box.getId(), PERIOD_START, PERIOD_END))
                    .thenReturn(Optional.empty());
            when(usageTrackingService.calculateUsage(box.getId(), plan, box)).thenReturn(usage(78, 4));
            when(overageRepository.saveAndFlush(any(OverageBillingRecord.class))).thenAnswer(inv -> {
                OverageBillingRecord record = inv.getArgument(0);
                record.setId(UUID.randomUUID());
                return record;
            });

            OverageRunSummary summary = service.processPeriodOverageBilling();

            assertThat(summary).isEqualTo(new OverageRunSummary(2, 1, 0, 1));
        }
    }

    @Nested
    @DisplayName("markPaid")
    class MarkPaidTests {

        @Test
        @DisplayName("Marks a calculated record paid with the invoice id")
        void calculated_becomesPaid() {
            OverageBillingRecord record = new OverageBillingRecord();
            record.setId(UUID.randomUUID());
            when(overageRepository.findById(record.getId())).thenReturn(Optional.of(record));
            when(overageRepository.save(record)).thenReturn(record);

            OverageBillingRecord paid = service.markPaid(record.getId(), "in_42");

            assertThat(paid.getStatus()).isEqualTo(OverageBillingStatus.PAID);
            assertThat(paid.getProviderInvoiceId()).isEqualTo("in_42");
            assertThat(paid.getPaidAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("A waived record cannot be paid")
        void waived_throws() {
            OverageBillingRecord record = new OverageBillingRecord();
            record.setId(UUID.randomUUID());
            record.setStatus(OverageBillingStatus.WAIVED);
            when(overageRepository.findById(record.getId())).thenReturn(Optional.of(record));

            assertThatThrownBy(() -> service.markPaid(record.getId(), "in_42"))
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
