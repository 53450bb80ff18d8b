package uk.gegc.boxbilling.features.billing.application.event;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Provider-neutral webhook envelope: {@code {type, id, data, metadata?}}.
 *
 * @param id provider event id, the idempotency key
 */
public record NormalizedBillingEvent(
        String type,
        String id,
        JsonNode data,
        EventMetadata metadata
) {
    public record EventMetadata(String boxId, String source) {
    }
}
