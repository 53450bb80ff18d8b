package uk.gegc.boxbilling.features.billing.application.event;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionStatus;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionTier;
import uk.gegc.boxbilling.shared.exception.ValidationException;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.UUID;

/**
 * Reads typed snapshots out of an event's {@code data} node. Field names are accepted in both
 * snake_case and camelCase; timestamps as epoch seconds or ISO-8601.
 */
public final class BillingEventPayloads {

    private BillingEventPayloads() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Providers wrap the entity in {@code data.object}; unwrap it when present.
     */
    public static JsonNode unwrap(JsonNode data) {
        if (data != null && data.has("object") && data.get("object").isObject()) {
            return data.get("object");
        }
        return data;
    }

    public static SubscriptionSnapshot subscription(JsonNode data) {
        JsonNode node = unwrap(data);
        String status = text(node, "status");
        return new SubscriptionSnapshot(
                requiredText(node, "id"),
                text(node, "customer_id", "customerId", "customer"),
                status == null ? null : SubscriptionStatus.fromValue(status)
                        .orElseThrow(() -> new ValidationException("Unknown subscription status '" + status + "'")),
                tier(node),
                text(node, "product_id", "productId"),
                instant(node, "current_period_start", "currentPeriodStart"),
                instant(node, "current_period_end", "currentPeriodEnd"),
                bool(node, "cancel_at_period_end", "cancelAtPeriodEnd"),
                instant(node, "canceled_at", "canceledAt"),
                instant(node, "ends_at", "endsAt", "cancel_at", "cancelAt"),
                text(node, "cancel_reason", "cancelReason", "customer_cancellation_reason"),
                text(node, "currency"),
                longValue(node, "amount"),
                text(node, "recurring_interval", "recurringInterval", "interval")
        );
    }

    public static InvoiceSnapshot invoice(JsonNode data) {
        JsonNode node = unwrap(data);
        JsonNode metadata = node.path("metadata");
        String overageId = text(metadata, "overage_billing_id", "overageBillingId");
        Long amount = longValue(node, "amount", "total_amount", "totalAmount", "amount_paid");
        return new InvoiceSnapshot(
                requiredText(node, "id"),
                text(node, "subscription_id", "subscriptionId", "subscription"),
                text(node, "customer_id", "customerId", "customer"),
                amount == null ? 0L : amount,
                defaultIfNull(text(node, "currency"), "usd"),
                text(node, "status"),
                instant(node, "paid_at", "paidAt", "created_at", "createdAt"),
                overageId == null ? null : uuid(overageId),
                text(node, "failure_reason", "failureReason")
        );
    }

    public static CustomerSnapshot customer(JsonNode data) {
        JsonNode node = unwrap(data);
        return new CustomerSnapshot(requiredText(node, "id"), text(node, "email"), text(node, "name"));
    }

    public static CheckoutSnapshot checkout(JsonNode data) {
        JsonNode node = unwrap(data);
        return new CheckoutSnapshot(
                requiredText(node, "id"),
                text(node, "customer_id", "customerId", "customer"),
                text(node, "subscription_id", "subscriptionId", "subscription"),
                tier(node)
        );
    }

    /**
     * Box id from {@code data.metadata}, the provider echo of what was attached at checkout.
     */
    public static String metadataBoxId(JsonNode data) {
        JsonNode node = unwrap(data);
        return text(node.path("metadata"), "boxId", "box_id");
    }

    public static String entityId(JsonNode data) {
        return text(unwrap(data), "id");
    }

    public static String text(JsonNode node, String... fields) {
        if (node == null) {
            return null;
        }
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && value.isValueNode()) {
                String text = value.asText();
                if (!text.isBlank()) {
                    return text;
                }
            }
        }
        return null;
    }

    public static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            return Instant.ofEpochSecond(Long.parseLong(trimmed));
        }
        try {
            return Instant.parse(trimmed);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(trimmed).toInstant();
            } catch (DateTimeParseException nested) {
                throw new ValidationException("Invalid timestamp '" + value + "'");
            }
        }
    }

    private static String requiredText(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null) {
            throw new ValidationException("Event data is missing '" + field + "'");
        }
        return value;
    }

    private static SubscriptionTier tier(JsonNode node) {
        String tier = text(node, "tier");
        if (tier == null) {
            tier = text(node.path("metadata"), "tier", "plan_tier", "planTier");
        }
        return tier == null ? null : SubscriptionTier.fromValue(tier).orElse(null);
    }

    private static Instant instant(JsonNode node, String... fields) {
        return parseInstant(text(node, fields));
    }

    private static boolean bool(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) {
                return value.asBoolean(false);
            }
        }
        return false;
    }

    private static Long longValue(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isNumber()) {
                return value.asLong();
            }
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                try {
                    return Long.parseLong(value.asText().trim());
                } catch (NumberFormatException e) {
                    throw new ValidationException("Field '" + field + "' is not a number");
                }
            }
        }
        return null;
    }

    private static UUID uuid(String value) {
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid id '" + value + "'");
        }
    }

    private static String defaultIfNull(String value, String fallback) {
        return value == null ? fallback : value;
    }
}
