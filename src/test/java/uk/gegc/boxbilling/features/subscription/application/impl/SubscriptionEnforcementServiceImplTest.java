package uk.gegc.boxbilling.features.subscription.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.boxbilling.features.billing.application.BillingMetricsService;
import uk.gegc.boxbilling.features.box.domain.model.Box;
import uk.gegc.boxbilling.features.box.domain.model.BoxStatus;
import uk.gegc.boxbilling.features.box.infra.repository.BoxRepository;
import uk.gegc.boxbilling.features.subscription.application.BoxStatusTransitions;
import uk.gegc.boxbilling.features.subscription.application.EnforcementSummary;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionStatus;
import uk.gegc.boxbilling.features.usage.application.UsageEventRecorder;
import uk.gegc.boxbilling.features.usage.domain.model.UsageEventType;
import uk.gegc.boxbilling.shared.util.RequiresNewTransactions;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SubscriptionEnforcementServiceImpl")
class SubscriptionEnforcementServiceImplTest {

    private static final Instant NOW = Instant.parse("2025-03-10T03:00:00Z");

    @Mock
    private BoxRepository boxRepository;
    @Mock
    private UsageEventRecorder usageEventRecorder;
    @Mock
    private BillingMetricsService metricsService;

    private SubscriptionEnforcementServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new SubscriptionEnforcementServiceImpl(
                boxRepository,
                new BoxStatusTransitions(),
                usageEventRecorder,
                metricsService,
                new RequiresNewTransactions(),
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
        lenient().when(boxRepository.save(any(Box.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private Box stored(Box box) {
        box.setId(UUID.randomUUID());
        box.setName("Box " + box.getId());
        lenient().when(boxRepository.findById(box.getId())).thenReturn(Optional.of(box));
        return box;
    }

    private Box expiredTrial() {
        Box box = new Box();
        box.setStatus(BoxStatus.ACTIVE);
        box.setSubscriptionStatus(SubscriptionStatus.TRIAL);
        box.setTrialEndsAt(NOW.minus(Duration.ofDays(2)));
        return stored(box);
    }

    private Box lapsedCancellation() {
        Box box = new Box();
        box.setStatus(BoxStatus.ACTIVE);
        box.setSubscriptionStatus(SubscriptionStatus.CANCELED);
        box.setProviderSubscriptionId("sub_" + UUID.randomUUID());
        box.setSubscriptionEndsAt(NOW.minus(Duration.ofHours(3)));
        return stored(box);
    }

    @Test
    @DisplayName("Expires lapsed trials and suspends ended subscriptions")
    void sweep_correctsBoxes() {
        Box trial = expiredTrial();
        Box lapsed = lapsedCancellation();
        when(boxRepository.findExpiredTrialsWithoutSubscription(NOW)).thenReturn(List.of(trial));
        when(boxRepository.findActiveBoxesWithLapsedCancellation(NOW)).thenReturn(List.of(lapsed));

        EnforcementSummary summary = service.enforceSubscriptionRules();

        assertThat(summary).isEqualTo(new EnforcementSummary(1, 1, 0));
        assertThat(trial.getStatus()).isEqualTo(BoxStatus.TRIAL_EXPIRED);
        assertThat(lapsed.getStatus()).isEqualTo(BoxStatus.SUSPENDED);
        verify(usageEventRecorder).record(eq(trial), eq(UsageEventType.TRIAL_EXPIRED), anyMap());
        verify(metricsService).incrementReconciliationCorrection("trial_expired");
        verify(metricsService).incrementReconciliationCorrection("suspended");
    }

    @Test
    @DisplayName("A second run over the same boxes changes nothing")
    void secondRun_isNoop() {
        Box trial = expiredTrial();
        Box lapsed = lapsedCancellation();
        when(boxRepository.findExpiredTrialsWithoutSubscription(NOW)).thenReturn(List.of(trial));
        when(boxRepository.findActiveBoxesWithLapsedCancellation(NOW)).thenReturn(List.of(lapsed));

        service.enforceSubscriptionRules();
        EnforcementSummary second = service.enforceSubscriptionRules();

        assertThat(second).isEqualTo(new EnforcementSummary(0, 0, 0));
        verify(boxRepository, times(2)).save(any(Box.class));
    }

    @Test
    @DisplayName("A trial that got a subscription after the query is left alone")
    void trialLinkedMeanwhile_skipped() {
        Box trial = expiredTrial();
        when(boxRepository.findExpiredTrialsWithoutSubscription(NOW)).thenReturn(List.of(trial));
        when(boxRepository.findActiveBoxesWithLapsedCancellation(NOW)).thenReturn(List.of());
        trial.setProviderSubscriptionId("sub_new");

        EnforcementSummary summary = service.enforceSubscriptionRules();

        assertThat(summary.trialsExpired()).isZero();
        assertThat(trial.getStatus()).isEqualTo(BoxStatus.ACTIVE);
    }

    @Test
    @DisplayName("A failing box is counted and the sweep continues")
    void failingBox_isolated() {
        Box broken = lapsedCancellation();
        Box lapsed = lapsedCancellation();
        when(boxRepository.findExpiredTrialsWithoutSubscription(NOW)).thenReturn(List.of());
        when(boxRepository.findActiveBoxesWithLapsedCancellation(NOW)).thenReturn(List.of(broken, lapsed));
        when(boxRepository.save(broken)).thenThrow(new IllegalStateException("row locked"));

        EnforcementSummary summary = service.enforceSubscriptionRules();

        assertThat(summary).isEqualTo(new EnforcementSummary(0, 1, 1));
        assertThat(lapsed.getStatus()).isEqualTo(BoxStatus.SUSPENDED);
    }
}
