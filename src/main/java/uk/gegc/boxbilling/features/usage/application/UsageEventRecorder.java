package uk.gegc.boxbilling.features.usage.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.boxbilling.features.box.domain.model.Box;
import uk.gegc.boxbilling.features.usage.domain.model.UsageEvent;
import uk.gegc.boxbilling.features.usage.domain.model.UsageEventType;
import uk.gegc.boxbilling.features.usage.infra.repository.UsageEventRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;

/**
 * Appends audit {@link UsageEvent}s stamped with the box's current billing period.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UsageEventRecorder {

    private final UsageEventRepository usageEventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public UsageEvent record(Box box, UsageEventType type, Map<String, ?> metadata) {
        return record(box.getId(), currentBillingPeriod(box), type, 1, null, null, false, metadata);
    }

    public UsageEvent record(UUID boxId,
                             BillingPeriod period,
                             UsageEventType type,
                             int quantity,
                             UUID entityId,
                             UUID userId,
                             boolean billable,
                             Map<String, ?> metadata) {
        UsageEvent event = new UsageEvent();
        event.setBoxId(boxId);
        event.setEventType(type);
        event.setQuantity(quantity);
        event.setEntityId(entityId);
        event.setUserId(userId);
        event.setBillable(billable);
        event.setMetadata(toJson(metadata));
        if (period != null) {
            event.setBillingPeriodStart(period.start());
            event.setBillingPeriodEnd(period.end());
        }
        event.setCreatedAt(Instant.now(clock));
        return usageEventRepository.save(event);
    }

    /**
     * The month ending at {@code nextBillingDate}, or the current calendar month (UTC) when the box has
     * no billing date yet.
     */
    public BillingPeriod currentBillingPeriod(Box box) {
        Instant nextBillingDate = box == null ? null : box.getNextBillingDate();
        if (nextBillingDate != null) {
            Instant start = nextBillingDate.atZone(ZoneOffset.UTC).minusMonths(1).toInstant();
            return new BillingPeriod(start, nextBillingDate);
        }
        YearMonth month = YearMonth.now(clock.withZone(ZoneOffset.UTC));
        return new BillingPeriod(
                month.atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant(),
                month.plusMonths(1).atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant()
        );
    }

    private String toJson(Map<String, ?> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Usage event metadata is not serializable", e);
        }
    }
}
