package uk.gegc.boxbilling.features.subscription.infra.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import uk.gegc.boxbilling.features.subscription.domain.model.PlanChangeDirection;
import uk.gegc.boxbilling.features.subscription.domain.model.PlanChangeRequest;
import uk.gegc.boxbilling.features.subscription.domain.model.PlanChangeStatus;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionChange;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionChangeType;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionTier;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@TestPropertySource(properties = {
        "spring.flyway.enabled=false",
        "spring.jpa.hibernate.ddl-auto=create-drop"
})
class PlanChangeRequestRepositoryTest {

    private static final Instant NOW = Instant.now().truncatedTo(ChronoUnit.SECONDS);

    @Autowired
    private PlanChangeRequestRepository requestRepository;

    @Autowired
    private SubscriptionChangeRepository changeRepository;

    private PlanChangeRequest request(UUID boxId, PlanChangeStatus status, Instant createdAt) {
        PlanChangeRequest request = new PlanChangeRequest();
        request.setBoxId(boxId);
        request.setSubscriptionId(UUID.randomUUID());
        request.setFromPlanId(UUID.randomUUID());
        request.setToPlanId(UUID.randomUUID());
        request.setFromTier(SubscriptionTier.SEED);
        request.setToTier(SubscriptionTier.GROW);
        request.setDirection(PlanChangeDirection.UPGRADE);
        request.setStatus(status);
        request.setRequestedBy("owner-1");
        request.setCreatedAt(createdAt);
        request.setUpdatedAt(createdAt);
        return request;
    }

    @Test
    @DisplayName("Pending requests are listed newest first, other boxes and statuses excluded")
    void pendingNewestFirst() {
        UUID boxId = UUID.randomUUID();
        PlanChangeRequest older = requestRepository.save(request(boxId, PlanChangeStatus.PENDING, NOW.minus(Duration.ofHours(2))));
        PlanChangeRequest newer = requestRepository.save(request(boxId, PlanChangeStatus.PENDING, NOW));
        requestRepository.save(request(boxId, PlanChangeStatus.CANCELED, NOW));
        requestRepository.save(request(UUID.randomUUID(), PlanChangeStatus.PENDING, NOW));
        requestRepository.flush();

        List<PlanChangeRequest> pending = requestRepository.findByBoxIdAndStatusOrderByCreatedAtDesc(boxId, PlanChangeStatus.PENDING);

        assertThat(pending).extracting(PlanChangeRequest::getId).containsExactly(newer.getId(), older.getId());
        assertThat(requestRepository.existsByBoxIdAndStatus(boxId, PlanChangeStatus.PENDING)).isTrue();
        assertThat(requestRepository.existsByBoxIdAndStatus(boxId, PlanChangeStatus.APPROVED)).isFalse();
    }

    @Test
    @DisplayName("Subscription history is paged newest first per box")
    void historyNewestFirst() {
        UUID boxId = UUID.randomUUID();
        UUID subscriptionId = UUID.randomUUID();
        for (int hoursAgo = 3; hoursAgo >= 0; hoursAgo--) {
            SubscriptionChange change = new SubscriptionChange();
            change.setBoxId(boxId);
            change.setSubscriptionId(subscriptionId);
            change.setChangeType(SubscriptionChangeType.UPDATED);
            change.setReason("h-" + hoursAgo);
            change.setCreatedAt(NOW.minus(Duration.ofHours(hoursAgo)));
            changeRepository.save(change);
        }
        changeRepository.flush();

        List<SubscriptionChange> latest = changeRepository.findByBoxIdOrderByCreatedAtDesc(boxId, PageRequest.of(0, 2));

        assertThat(latest).extracting(SubscriptionChange::getReason).containsExactly("h-0", "h-1");
    }
}
