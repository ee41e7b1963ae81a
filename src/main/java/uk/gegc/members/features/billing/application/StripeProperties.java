package uk.gegc.members.features.billing.application;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Stripe configuration properties.
 */
@Configuration
@ConfigurationProperties(prefix = "stripe")
@Data
public class StripeProperties {
    /** Secret API key (server-side). Stripe operations are unavailable while it is blank. */
    private String secretKey;
}
