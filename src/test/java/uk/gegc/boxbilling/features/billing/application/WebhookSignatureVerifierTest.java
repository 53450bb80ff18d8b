package uk.gegc.boxbilling.features.billing.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.boxbilling.features.billing.domain.exception.WebhookSignatureException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebhookSignatureVerifierTest {

    private static final String SECRET = "whsec_test_secret";
    private static final String PAYLOAD = "{\"type\":\"subscription.created\",\"id\":\"evt_1\",\"data\":{\"id\":\"sub_1\"}}";

    private BillingProperties properties;
    private WebhookSignatureVerifier verifier;

    @BeforeEach
    void setUp() {
        properties = new BillingProperties();
        properties.getWebhook().setSigningSecret(SECRET);
        verifier = new WebhookSignatureVerifier(properties);
    }

    private static String sign(String payload, String secret, long timestamp) throws Exception {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        byte[] digest = mac.doFinal((timestamp + "." + payload).getBytes(StandardCharsets.UTF_8));
        return "t=" + timestamp + ",v1=" + HexFormat.of().formatHex(digest);
    }

    @Test
    @DisplayName("Valid signature passes")
    void validSignature_passes() throws Exception {
        String header = sign(PAYLOAD, SECRET, Instant.now().getEpochSecond());

        assertThatCode(() -> verifier.verify(PAYLOAD, header)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Signature made with another secret is rejected")
    void wrongSecret_rejected() throws Exception {
        String header = sign(PAYLOAD, "whsec_other", Instant.now().getEpochSecond());

        assertThatThrownBy(() -> verifier.verify(PAYLOAD, header))
                .isInstanceOf(WebhookSignatureException.class)
                .hasMessage("Invalid webhook signature");
    }

    @Test
    @DisplayName("Tampered payload is rejected")
    void tamperedPayload_rejected() throws Exception {
        String header = sign(PAYLOAD, SECRET, Instant.now().getEpochSecond());

        assertThatThrownBy(() -> verifier.verify(PAYLOAD.replace("sub_1", "sub_2"), header))
                .isInstanceOf(WebhookSignatureException.class);
    }

    @Test
    @DisplayName("Signature older than the tolerance is rejected")
    void staleTimestamp_rejected() throws Exception {
        String header = sign(PAYLOAD, SECRET, Instant.now().minusSeconds(3600).getEpochSecond());

        assertThatThrownBy(() -> verifier.verify(PAYLOAD, header))
                .isInstanceOf(WebhookSignatureException.class);
    }

    @Test
    @DisplayName("Missing header is rejected when a secret is configured")
    void missingHeader_rejected() {
        assertThatThrownBy(() -> verifier.verify(PAYLOAD, null))
                .isInstanceOf(WebhookSignatureException.class)
                .hasMessage("Missing webhook signature");
    }

    @Test
    @DisplayName("Without a secret verification is skipped")
    void noSecret_skipped() {
        properties.getWebhook().setSigningSecret(" ");

        assertThat(verifier.isEnabled()).isFalse();
        assertThatCode(() -> verifier.verify(PAYLOAD, null)).doesNotThrowAnyException();
    }
}
