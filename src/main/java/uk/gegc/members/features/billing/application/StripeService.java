package uk.gegc.members.features.billing.application;

import com.stripe.exception.StripeException;
import com.stripe.model.Customer;
import com.stripe.model.PaymentMethod;
import com.stripe.model.Subscription;

import java.util.Optional;

/**
 * Stripe gateway used to reconcile members with their Stripe customers and subscriptions.
 * Every call except {@link #isConfigured()} requires a configured Stripe connection.
 */
public interface StripeService {

    /**
     * Whether a Stripe secret key and client are available.
     */
    boolean isConfigured();

    /**
     * Retrieve a customer with its subscriptions expanded.
     *
     * @param customerId Stripe customer ID
     * @return the customer (possibly marked deleted), or empty when Stripe has no such customer
     */
    Optional<Customer> getCustomer(String customerId) throws StripeException;

    /**
     * Create a Stripe Customer.
     *
     * @param email customer email address
     */
    Customer createCustomer(String email) throws StripeException;

    Customer updateCustomerEmail(String customerId, String email) throws StripeException;

    Subscription getSubscription(String subscriptionId) throws StripeException;

    /**
     * Create a subscription for the customer on the given plan (Stripe price).
     */
    Subscription createSubscription(String customerId, String planId) throws StripeException;

    /**
     * Move the subscription's single item to another plan. Resets cancel-at-period-end and the
     * recorded cancellation reason.
     */
    Subscription changeSubscriptionPlan(String subscriptionId, String planId) throws StripeException;

    /**
     * Cancel a subscription immediately.
     */
    Subscription cancelSubscription(String subscriptionId) throws StripeException;

    Subscription cancelSubscriptionAtPeriodEnd(String subscriptionId) throws StripeException;

    Subscription continueSubscriptionAtPeriodEnd(String subscriptionId) throws StripeException;

    /**
     * Retrieve a payment method, empty unless it is a card.
     */
    Optional<PaymentMethod> getCardPaymentMethod(String paymentMethodId) throws StripeException;
}
