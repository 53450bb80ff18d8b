package uk.gegc.boxbilling.features.box.infra.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import uk.gegc.boxbilling.features.box.domain.model.Box;
import uk.gegc.boxbilling.features.box.domain.model.BoxMembership;
import uk.gegc.boxbilling.features.box.domain.model.BoxStatus;
import uk.gegc.boxbilling.features.box.domain.model.MembershipRole;
import uk.gegc.boxbilling.features.subscription.domain.model.Subscription;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionStatus;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionTier;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
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
class BoxRepositoryTest {

    private static final Instant NOW = Instant.now().truncatedTo(ChronoUnit.SECONDS);

    @Autowired
    private BoxRepository boxRepository;

    @Autowired
    private BoxMembershipRepository membershipRepository;

    @Autowired
    private TestEntityManager entityManager;

    private Box box(String name, BoxStatus status, SubscriptionStatus subscriptionStatus) {
        Box box = new Box();
        box.setName(name);
        box.setStatus(status);
        box.setSubscriptionStatus(subscriptionStatus);
        return box;
    }

    private Subscription subscription(Box box, SubscriptionStatus status, boolean cancelAtPeriodEnd) {
        Subscription subscription = new Subscription();
        subscription.setBoxId(box.getId());
        subscription.setPlanId(UUID.randomUUID());
        subscription.setPlanTier(SubscriptionTier.SEED);
        subscription.setPlanVersion(1);
        subscription.setProviderSubscriptionId(box.getProviderSubscriptionId());
        subscription.setStatus(status);
        subscription.setCurrentPeriodStart(NOW.minus(Duration.ofDays(31)));
        subscription.setCurrentPeriodEnd(NOW.minus(Duration.ofDays(1)));
        subscription.setCancelAtPeriodEnd(cancelAtPeriodEnd);
        return subscription;
    }

    @Test
    @DisplayName("findExpiredTrialsWithoutSubscription returns only unlinked trials past their end")
    void expiredTrials() {
        Box expired = box("expired", BoxStatus.ACTIVE, SubscriptionStatus.TRIAL);
        expired.setTrialEndsAt(NOW.minus(Duration.ofDays(1)));
        entityManager.persist(expired);

        Box running = box("running", BoxStatus.ACTIVE, SubscriptionStatus.TRIAL);
        running.setTrialEndsAt(NOW.plus(Duration.ofDays(1)));
        entityManager.persist(running);

        Box linked = box("linked", BoxStatus.ACTIVE, SubscriptionStatus.TRIAL);
        linked.setTrialEndsAt(NOW.minus(Duration.ofDays(1)));
        linked.setProviderSubscriptionId("sub_linked");
        entityManager.persist(linked);

        Box alreadyMarked = box("marked", BoxStatus.TRIAL_EXPIRED, SubscriptionStatus.TRIAL);
        alreadyMarked.setTrialEndsAt(NOW.minus(Duration.ofDays(1)));
        entityManager.persist(alreadyMarked);
        entityManager.flush();

        List<Box> result = boxRepository.findExpiredTrialsWithoutSubscription(NOW);

        assertThat(result).extracting(Box::getName).containsExactly("expired");
    }

    @Test
    @DisplayName("findActiveBoxesWithLapsedCancellation covers canceled and cancel-at-period-end subscriptions")
    void lapsedCancellations() {
        Box canceled = box("canceled", BoxStatus.ACTIVE, SubscriptionStatus.CANCELED);
        canceled.setProviderSubscriptionId("sub_canceled");
        canceled.setSubscriptionEndsAt(NOW.minus(Duration.ofHours(1)));
        entityManager.persist(canceled);
        entityManager.persist(subscription(canceled, SubscriptionStatus.CANCELED, false));

        Box scheduled = box("scheduled", BoxStatus.ACTIVE, SubscriptionStatus.ACTIVE);
        scheduled.setProviderSubscriptionId("sub_scheduled");
        scheduled.setSubscriptionEndsAt(NOW.minus(Duration.ofHours(1)));
        entityManager.persist(scheduled);
        entityManager.persist(subscription(scheduled, SubscriptionStatus.ACTIVE, true));

        Box renewing = box("renewing", BoxStatus.ACTIVE, SubscriptionStatus.ACTIVE);
        renewing.setProviderSubscriptionId("sub_renewing");
        renewing.setSubscriptionEndsAt(NOW.minus(Duration.ofHours(1)));
        entityManager.persist(renewing);
        entityManager.persist(subscription(renewing, SubscriptionStatus.ACTIVE, false));

        Box suspended = box("suspended", BoxStatus.SUSPENDED, SubscriptionStatus.CANCELED);
        suspended.setProviderSubscriptionId("sub_suspended");
        suspended.setSubscriptionEndsAt(NOW.minus(Duration.ofHours(1)));
        entityManager.persist(suspended);
        entityManager.persist(subscription(suspended, SubscriptionStatus.CANCELED, false));
        entityManager.flush();

        List<Box> result = boxRepository.findActiveBoxesWithLapsedCancellation(NOW);

        assertThat(result).extracting(Box::getName).containsExactlyInAnyOrder("canceled", "scheduled");
    }

    @Test
    @DisplayName("Member counts include only active members of the given roles")
    void membershipCounts() {
        Box box = entityManager.persist(box("counted", BoxStatus.ACTIVE, SubscriptionStatus.ACTIVE));
        membership(box, MembershipRole.ATHLETE, true);
        membership(box, MembershipRole.ATHLETE, true);
        membership(box, MembershipRole.ATHLETE, false);
        membership(box, MembershipRole.COACH, true);
        membership(box, MembershipRole.HEAD_COACH, true);
        entityManager.flush();

        assertThat(membershipRepository.countByBoxIdAndActiveTrueAndRoleIn(box.getId(), EnumSet.of(MembershipRole.ATHLETE)))
                .isEqualTo(2);
        assertThat(membershipRepository.countByBoxIdAndActiveTrueAndRoleIn(box.getId(),
                EnumSet.of(MembershipRole.COACH, MembershipRole.HEAD_COACH))).isEqualTo(2);
    }

    @Test
    @DisplayName("Boxes are found by provider subscription and customer")
    void providerLookups() {
        Box box = box("linked", BoxStatus.ACTIVE, SubscriptionStatus.ACTIVE);
        box.setProviderSubscriptionId("sub_lookup");
        box.setProviderCustomerId("cus_lookup");
        entityManager.persistAndFlush(box);

        assertThat(boxRepository.findByProviderSubscriptionId("sub_lookup")).map(Box::getId).contains(box.getId());
        assertThat(boxRepository.findFirstByProviderCustomerId("cus_lookup")).map(Box::getId).contains(box.getId());
        assertThat(boxRepository.findByProviderSubscriptionId("sub_other")).isEmpty();
    }

    private void membership(Box box, MembershipRole role, boolean active) {
        BoxMembership membership = new BoxMembership();
        membership.setBoxId(box.getId());
        membership.setUserId(UUID.randomUUID());
        membership.setRole(role);
        membership.setActive(active);
        membership.setJoinedAt(NOW);
        entityManager.persist(membership);
    }
}
