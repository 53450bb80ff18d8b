package uk.gegc.boxbilling.shared.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for feature flags
 */
@Component
@ConfigurationProperties(prefix = "boxbilling.features")
public class FeatureFlags {

    private boolean billing = true;
    private boolean overageBilling = true;

    public boolean isBilling() {
        return billing;
    }

    public void setBilling(boolean billing) {
        this.billing = billing;
    }

    public boolean isOverageBilling() {
        return overageBilling;
    }

    public void setOverageBilling(boolean overageBilling) {
        this.overageBilling = overageBilling;
    }
}
