package uk.gegc.boxbilling.features.usage.infra.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import uk.gegc.boxbilling.features.usage.domain.model.OverageBillingRecord;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@TestPropertySource(properties = {
        "spring.flyway.enabled=false",
        "spring.jpa.hibernate.ddl-auto=create-drop"
})
class OverageBillingRecordRepositoryTest {

    private static final Instant PERIOD_START = Instant.now().truncatedTo(ChronoUnit.SECONDS).minus(Duration.ofDays(30));
    private static final Instant PERIOD_END = PERIOD_START.plus(Duration.ofDays(30));

    @Autowired
    private OverageBillingRecordRepository repository;

    private OverageBillingRecord record(UUID boxId, Instant start, Instant end) {
        OverageBillingRecord record = new OverageBillingRecord();
        record.setBoxId(boxId);
        record.setSubscriptionId(UUID.randomUUID());
        record.setBillingPeriodStart(start);
        record.setBillingPeriodEnd(end);
        record.setAthleteLimit(75);
        record.setCoachLimit(3);
        record.setAthleteCount(80);
        record.setCoachCount(3);
        record.setAthleteOverage(5);
        record.setAthleteOverageRate(100);
        record.setCoachOverageRate(100);
        record.setAthleteOverageAmount(500);
        record.setTotalOverageAmount(500);
        record.setCreatedAt(PERIOD_END);
        return record;
    }

    @Test
    @DisplayName("One record per box and billing period")
    void periodIsUnique() {
        UUID boxId = UUID.randomUUID();
        repository.saveAndFlush(record(boxId, PERIOD_START, PERIOD_END));

        assertThatThrownBy(() -> repository.saveAndFlush(record(boxId, PERIOD_START, PERIOD_END)))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("Different periods for the same box are kept side by side")
    void periodsAccumulate() {
        UUID boxId = UUID.randomUUID();
        repository.saveAndFlush(record(boxId, PERIOD_START, PERIOD_END));
        repository.saveAndFlush(record(boxId, PERIOD_END, PERIOD_END.plus(Duration.ofDays(30))));

        assertThat(repository.countByBoxId(boxId)).isEqualTo(2);
        assertThat(repository.findByBoxIdAndBillingPeriodStartAndBillingPeriodEnd(boxId, PERIOD_START, PERIOD_END))
                .map(OverageBillingRecord::getTotalOverageAmount)
                .contains(500L);
    }
}
