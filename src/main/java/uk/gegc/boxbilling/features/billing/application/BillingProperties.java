package uk.gegc.boxbilling.features.billing.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;
import uk.gegc.boxbilling.features.subscription.domain.model.SubscriptionTier;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Billing engine configuration (webhook retries, overage, reconciliation, plan mapping).
 */
@Configuration
@ConfigurationProperties(prefix = "billing")
@Validated
@Data
public class BillingProperties {

    @Valid
    private Webhook webhook = new Webhook();

    @Valid
    private Overage overage = new Overage();

    @Valid
    private Reconciliation reconciliation = new Reconciliation();

    @Valid
    private GracePeriods gracePeriods = new GracePeriods();

    @Valid
    private Plans plans = new Plans();

    @Valid
    private Defaults defaults = new Defaults();

    @Data
    public static class Webhook {
        /**
         * Shared secret for the signature header. Verification is skipped when blank.
         */
        private String signingSecret;

        @Positive
        private long signatureToleranceSeconds = 300L;

        /**
         * Attempts after which a failed event becomes terminal.
         */
        @Positive
        private int maxRetries = 3;

        /**
         * First retry delay; doubles on every further failure.
         */
        @Positive
        private int retryBaseDelayMinutes = 5;

        @Positive
        private int retryBatchSize = 50;

        /**
         * Pause between retry drains, in milliseconds.
         */
        @Positive
        private long retryDrainDelayMs = 60_000L;
    }

    @Data
    public static class Overage {
        /**
         * Per-unit rate in minor currency units, used when the plan has none.
         */
        @Min(0)
        private int defaultRate = 100;

        private boolean enabled = true;

        @NotBlank
        private String cron = "0 0 2 1 * *";
    }

    @Data
    public static class Reconciliation {
        private boolean enabled = true;

        @NotBlank
        private String cron = "0 0 3 * * *";
    }

    @Data
    public static class GracePeriods {
        @NotBlank
        private String expiryCheckCron = "0 0 1 * * *";

        @Positive
        private int upcomingDays = 7;
    }

    @Data
    public static class Plans {
        /**
         * Provider product id to tier.
         */
        private Map<String, SubscriptionTier> productTiers = new LinkedHashMap<>(Map.of(
                "prod_seed_monthly", SubscriptionTier.SEED,
                "prod_seed_annual", SubscriptionTier.SEED,
                "prod_grow_monthly", SubscriptionTier.GROW,
                "prod_grow_annual", SubscriptionTier.GROW,
                "prod_scale_monthly", SubscriptionTier.SCALE,
                "prod_scale_annual", SubscriptionTier.SCALE
        ));
    }

    /**
     * Limits for a box whose plan and own limits are both unknown.
     */
    @Data
    public static class Defaults {
        @Positive
        private int athleteLimit = 75;

        @Positive
        private int coachLimit = 3;
    }
}
