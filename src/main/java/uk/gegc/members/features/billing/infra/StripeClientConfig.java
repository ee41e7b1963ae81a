package uk.gegc.members.features.billing.infra;

import com.stripe.StripeClient;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.members.features.billing.application.StripeProperties;

/**
 * Stripe client configuration.
 */
@Configuration
@RequiredArgsConstructor
public class StripeClientConfig {

    private final StripeProperties stripe;

    /**
     * Provide a reusable StripeClient only when the secret key is configured.
     */
    @Bean
    @ConditionalOnProperty(name = "stripe.secret-key")
    public StripeClient stripeClient() {
        return new StripeClient(stripe.getSecretKey());
    }
}
