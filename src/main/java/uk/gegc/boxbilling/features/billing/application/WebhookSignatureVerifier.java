package uk.gegc.boxbilling.features.billing.application;

import com.stripe.exception.SignatureVerificationException;
import com.stripe.net.Webhook;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uk.gegc.boxbilling.features.billing.domain.exception.WebhookSignatureException;

/**
 * Checks the {@code t=...,v1=...} HMAC-SHA256 signature header against the configured signing secret.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookSignatureVerifier {

    private final BillingProperties billingProperties;

    public boolean isEnabled() {
        return StringUtils.hasText(billingProperties.getWebhook().getSigningSecret());
    }

    public void verify(String payload, String signatureHeader) {
        if (!isEnabled()) {
            return;
        }
        if (!StringUtils.hasText(signatureHeader)) {
            throw new WebhookSignatureException("Missing webhook signature");
        }
        try {
            Webhook.Signature.verifyHeader(
                    payload,
                    signatureHeader,
                    billingProperties.getWebhook().getSigningSecret(),
                    billingProperties.getWebhook().getSignatureToleranceSeconds());
        } catch (SignatureVerificationException e) {
            log.warn("Webhook signature verification failed: {}", e.getMessage());
            throw new WebhookSignatureException("Invalid webhook signature", e);
        }
    }
}
