package uk.gegc.members.features.billing.application;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Member billing configuration (plan catalog parameters).
 */
@Configuration
@ConfigurationProperties(prefix = "members.billing")
@Validated
@Data
public class BillingProperties {
    /**
     * Price nickname that marks a plan as complimentary.
     */
    @NotBlank
    private String complimentaryNickname = "Complimentary";

    /**
     * Billing interval of the plan whose currency is used when a member has no active subscription.
     */
    @NotBlank
    private String defaultCurrencyInterval = "month";
}
