package uk.gegc.members.shared.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for feature flags
 */
@Component
@ConfigurationProperties(prefix = "members.features")
public class FeatureFlags {

    private boolean billing = false;

    public boolean isBilling() {
        return billing;
    }

    public void setBilling(boolean billing) {
        this.billing = billing;
    }
}
