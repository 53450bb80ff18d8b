package uk.gegc.boxbilling.features.billing.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.boxbilling.features.billing.application.BillingNotificationService;
import uk.gegc.boxbilling.features.billing.application.impl.NoopBillingNotificationService;

@Slf4j
@Configuration
public class BillingNotificationConfig {

    @Bean
    @ConditionalOnMissingBean(BillingNotificationService.class)
    public BillingNotificationService billingNotificationService() {
        log.info("No billing notification provider configured, using NoopBillingNotificationService");
        return new NoopBillingNotificationService();
    }
}
