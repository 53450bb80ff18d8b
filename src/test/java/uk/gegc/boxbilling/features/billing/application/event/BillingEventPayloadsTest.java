package uk.gegc.boxbilling.features.billing.application.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionStatus;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionTier;
import uk.gegc.boxbilling.shared.exception.ValidationException;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BillingEventPayloadsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private JsonNode json(String value) throws Exception {
        return objectMapper.readTree(value);
    }

    @Nested
    @DisplayName("subscription")
    class SubscriptionTests {

        @Test
        @DisplayName("Reads snake_case fields with epoch timestamps")
        void snakeCase_epochSeconds() throws Exception {
            SubscriptionSnapshot snapshot = BillingEventPayloads.subscription(json("""
                    {"id":"sub_1","customer_id":"cus_1","status":"past_due","product_id":"prod_grow_monthly",
                     "current_period_start":1740787200,"current_period_end":"1743465600",
                     "cancel_at_period_end":true,"metadata":{"tier":"grow"}}
                    """));

            assertThat(snapshot.providerSubscriptionId()).isEqualTo("sub_1");
            assertThat(snapshot.providerCustomerId()).isEqualTo("cus_1");
            assertThat(snapshot.status()).isEqualTo(SubscriptionStatus.PAST_DUE);
            assertThat(snapshot.tier()).isEqualTo(SubscriptionTier.GROW);
            assertThat(snapshot.currentPeriodStart()).isEqualTo(Instant.parse("2025-03-01T00:00:00Z"));
            assertThat(snapshot.currentPeriodEnd()).isEqualTo(Instant.parse("2025-04-01T00:00:00Z"));
            assertThat(snapshot.cancelAtPeriodEnd()).isTrue();
        }

        @Test
        @DisplayName("Unwraps data.object and reads camelCase ISO timestamps")
        void wrappedObject_camelCase() throws Exception {
            SubscriptionSnapshot snapshot = BillingEventPayloads.subscription(json("""
                    {"object":{"id":"sub_2","customerId":"cus_2","tier":"SCALE",
                     "currentPeriodEnd":"2025-04-01T00:00:00+02:00","endsAt":"2025-03-20T00:00:00Z"}}
                    """));

            assertThat(snapshot.providerSubscriptionId()).isEqualTo("sub_2");
            assertThat(snapshot.tier()).isEqualTo(SubscriptionTier.SCALE);
            assertThat(snapshot.status()).isNull();
            assertThat(snapshot.currentPeriodEnd()).isEqualTo(Instant.parse("2025-03-31T22:00:00Z"));
            assertThat(snapshot.endsAt()).isEqualTo(Instant.parse("2025-03-20T00:00:00Z"));
            assertThat(snapshot.cancelAtPeriodEnd()).isFalse();
        }

        @Test
        @DisplayName("Unknown status is rejected")
        void unknownStatus_rejected() {
            assertThatThrownBy(() -> BillingEventPayloads.subscription(json("{\"id\":\"sub_1\",\"status\":\"zombie\"}")))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("zombie");
        }

        @Test
        @DisplayName("Missing id is rejected")
        void missingId_rejected() {
            assertThatThrownBy(() -> BillingEventPayloads.subscription(json("{\"status\":\"active\"}")))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("invoice")
    class InvoiceTests {

        @Test
        @DisplayName("Reads amount, currency default and overage reference")
        void invoice_fields() throws Exception {
            UUID overageId = UUID.randomUUID();
            InvoiceSnapshot invoice = BillingEventPayloads.invoice(json("""
                    {"id":"in_1","subscription":"sub_1","total_amount":"1500",
                     "metadata":{"overage_billing_id":"%s"}}
                    """.formatted(overageId)));

            assertThat(invoice.invoiceId()).isEqualTo("in_1");
            assertThat(invoice.providerSubscriptionId()).isEqualTo("sub_1");
            assertThat(invoice.amount()).isEqualTo(1500L);
            assertThat(invoice.currency()).isEqualTo("usd");
            assertThat(invoice.overageBillingId()).isEqualTo(overageId);
        }

        @Test
        @DisplayName("Non-numeric amount is rejected")
        void badAmount_rejected() {
            assertThatThrownBy(() -> BillingEventPayloads.invoice(json("{\"id\":\"in_1\",\"amount\":\"ten\"}")))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Test
    @DisplayName("Box id is read from entity metadata in either spelling")
    void metadataBoxId() throws Exception {
        assertThat(BillingEventPayloads.metadataBoxId(json("{\"id\":\"x\",\"metadata\":{\"box_id\":\"b-1\"}}"))).isEqualTo("b-1");
        assertThat(BillingEventPayloads.metadataBoxId(json("{\"id\":\"x\",\"metadata\":{\"boxId\":\"b-2\"}}"))).isEqualTo("b-2");
        assertThat(BillingEventPayloads.metadataBoxId(json("{\"id\":\"x\"}"))).isNull();
    }

    @Test
    @DisplayName("Unparseable timestamp is rejected")
    void parseInstant_invalid() {
        assertThat(BillingEventPayloads.parseInstant(" ")).isNull();
        assertThatThrownBy(() -> BillingEventPayloads.parseInstant("yesterday"))
                .isInstanceOf(ValidationException.class);
    }
}
