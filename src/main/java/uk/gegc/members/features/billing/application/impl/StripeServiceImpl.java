package uk.gegc.members.features.billing.application.impl;

import com.stripe.StripeClient;
import com.stripe.exception.InvalidRequestException;
import com.stripe.exception.StripeException;
import com.stripe.model.Customer;
import com.stripe.model.PaymentMethod;
import com.stripe.model.Subscription;
import com.stripe.param.CustomerCreateParams;
import com.stripe.param.CustomerRetrieveParams;
import com.stripe.param.CustomerUpdateParams;
import com.stripe.param.SubscriptionCreateParams;
import com.stripe.param.SubscriptionUpdateParams;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.members.features.billing.application.StripeProperties;
import uk.gegc.members.features.billing.application.StripeService;
import uk.gegc.members.features.billing.domain.exception.StripeNotConfiguredException;

import java.util.Optional;

@Service
@RequiredArgsConstructor
public class StripeServiceImpl implements StripeService {

    private static final Logger log = LoggerFactory.getLogger(StripeServiceImpl.class);

    static final String RESOURCE_MISSING = "resource_missing";
    static final String CANCELLATION_REASON = "cancellation_reason";

    private final StripeProperties stripeProperties;
    @Autowired(required = false)
    private StripeClient stripeClient;

    @Override
    public boolean isConfigured() {
        return stripeClient != null && StringUtils.hasText(stripeProperties.getSecretKey());
    }

    @Override
    public Optional<Customer> getCustomer(String customerId) throws StripeException {
        requireText(customerId, "Customer ID must be provided");

        CustomerRetrieveParams params = CustomerRetrieveParams.builder()
                .addExpand("subscriptions")
                .build();
        try {
            return Optional.of(client().customers().retrieve(customerId, params));
        } catch (InvalidRequestException e) {
            if (RESOURCE_MISSING.equals(e.getCode())) {
                log.info("Stripe customer id={} does not exist", customerId);
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public Customer createCustomer(String email) throws StripeException {
        requireText(email, "Email must be provided for customer creation");

        CustomerCreateParams params = CustomerCreateParams.builder()
                .setEmail(email)
                .build();
        Customer customer = client().customers().create(params);

        log.info("Created Stripe customer id={} email={}", customer.getId(), email);
        return customer;
    }

    @Override
    public Customer updateCustomerEmail(String customerId, String email) throws StripeException {
        requireText(customerId, "Customer ID must be provided");
        requireText(email, "Email must be provided");

        CustomerUpdateParams params = CustomerUpdateParams.builder()
                .setEmail(email)
                .build();
        Customer customer = client().customers().update(customerId, params);

        log.info("Updated Stripe customer id={} email={}", customerId, email);
        return customer;
    }

    @Override
    public Subscription getSubscription(String subscriptionId) throws StripeException {
        requireText(subscriptionId, "Subscription ID must be provided");
        return client().subscriptions().retrieve(subscriptionId);
    }

    @Override
    public Subscription createSubscription(String customerId, String planId) throws StripeException {
        if (!StringUtils.hasText(customerId) || !StringUtils.hasText(planId)) {
            throw new IllegalArgumentException("Customer ID and Plan ID must be provided");
        }

        SubscriptionCreateParams params = SubscriptionCreateParams.builder()
                .setCustomer(customerId)
                .addItem(
                        SubscriptionCreateParams.Item.builder()
                                .setPrice(planId)
                                .build()
                )
                .build();
        Subscription subscription = client().subscriptions().create(params);

        log.info("Created Stripe subscription id={} for customer={} planId={}",
                subscription.getId(), customerId, planId);
        return subscription;
    }

    @Override
    public Subscription changeSubscriptionPlan(String subscriptionId, String planId) throws StripeException {
        if (!StringUtils.hasText(subscriptionId) || !StringUtils.hasText(planId)) {
            throw new IllegalArgumentException("Subscription ID and Plan ID must be provided");
        }

        // The item id is needed to replace the plan rather than add a second item
        Subscription current = client().subscriptions().retrieve(subscriptionId);
        if (current.getItems() == null || current.getItems().getData() == null || current.getItems().getData().isEmpty()) {
            throw new IllegalStateException("Stripe subscription " + subscriptionId + " has no items to change");
        }

        SubscriptionUpdateParams params = SubscriptionUpdateParams.builder()
                .addItem(
                        SubscriptionUpdateParams.Item.builder()
                                .setId(current.getItems().getData().get(0).getId())
                                .setPrice(planId)
                                .build()
                )
                .setProrationBehavior(SubscriptionUpdateParams.ProrationBehavior.ALWAYS_INVOICE)
                .setCancelAtPeriodEnd(false)
                .putMetadata(CANCELLATION_REASON, "")
                .build();
        Subscription subscription = client().subscriptions().update(subscriptionId, params);

        log.info("Changed Stripe subscription id={} to planId={}", subscriptionId, planId);
        return subscription;
    }

    @Override
    public Subscription cancelSubscription(String subscriptionId) throws StripeException {
        requireText(subscriptionId, "Subscription ID must be provided");

        Subscription subscription = client().subscriptions().cancel(subscriptionId);

        log.info("Cancelled Stripe subscription id={}", subscriptionId);
        return subscription;
    }

    @Override
    public Subscription cancelSubscriptionAtPeriodEnd(String subscriptionId) throws StripeException {
        requireText(subscriptionId, "Subscription ID must be provided");

        SubscriptionUpdateParams params = SubscriptionUpdateParams.builder()
                .setCancelAtPeriodEnd(true)
                .build();
        Subscription subscription = client().subscriptions().update(subscriptionId, params);

        log.info("Stripe subscription id={} set to cancel at period end", subscriptionId);
        return subscription;
    }

    @Override
    public Subscription continueSubscriptionAtPeriodEnd(String subscriptionId) throws StripeException {
        requireText(subscriptionId, "Subscription ID must be provided");

        SubscriptionUpdateParams params = SubscriptionUpdateParams.builder()
                .setCancelAtPeriodEnd(false)
                .putMetadata(CANCELLATION_REASON, "")
                .build();
        Subscription subscription = client().subscriptions().update(subscriptionId, params);

        log.info("Stripe subscription id={} set to continue at period end", subscriptionId);
        return subscription;
    }

    @Override
    public Optional<PaymentMethod> getCardPaymentMethod(String paymentMethodId) throws StripeException {
        requireText(paymentMethodId, "Payment method ID must be provided");

        PaymentMethod paymentMethod = client().paymentMethods().retrieve(paymentMethodId);
        if (!"card".equals(paymentMethod.getType())) {
            return Optional.empty();
        }
        return Optional.of(paymentMethod);
    }

    private StripeClient client() {
        if (!isConfigured()) {
            throw new StripeNotConfiguredException("call Stripe");
        }
        return stripeClient;
    }

    private static void requireText(String value, String message) {
        if (!StringUtils.hasText(value)) {
            throw new IllegalArgumentException(message);
        }
    }
}
