package uk.gegc.members.features.billing.application;

import com.stripe.exception.StripeException;
import com.stripe.model.Subscription;
import uk.gegc.members.features.billing.domain.model.ComplimentaryGrant;
import uk.gegc.members.features.billing.domain.model.ReconciliationOutcome;
import uk.gegc.members.features.billing.domain.model.StripeCustomer;
import uk.gegc.members.features.billing.domain.model.StripeCustomerSubscription;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Keeps the local mirror of members' Stripe customers and subscriptions consistent with Stripe
 * and grants or revokes complimentary access.
 * <p>
 * Every operation that talks to Stripe fails with
 * {@link uk.gegc.members.features.billing.domain.exception.StripeNotConfiguredException} before any
 * read or write when Stripe is not configured. Stripe errors propagate unchanged unless stated otherwise.
 */
public interface MemberSubscriptionService {

    /**
     * Link an existing Stripe customer, and all of its subscriptions, to a member.
     *
     * @param memberId   member to link to
     * @param customerId Stripe customer ID
     * @return the new customer record, or empty when Stripe has no such customer
     */
    Optional<StripeCustomer> linkCustomer(UUID memberId, String customerId) throws StripeException;

    /**
     * Mirror a Stripe subscription of one of the member's linked customers.
     * The subscription is re-read from Stripe; {@code subscription} only needs its id and customer.
     *
     * @return the mirrored row, inserted or overwritten by subscription id
     */
    StripeCustomerSubscription linkSubscription(UUID memberId, Subscription subscription) throws StripeException;

    /**
     * Set or clear cancel-at-period-end on a member's subscription, at Stripe first and then locally.
     *
     * @param cancelAtPeriodEnd required; {@code null} is rejected with {@link IllegalArgumentException}
     */
    StripeCustomerSubscription updateSubscriptionCancellation(UUID memberId, String subscriptionId,
                                                              Boolean cancelAtPeriodEnd) throws StripeException;

    /**
     * Give the member the complimentary plan in the currency of their current subscription, or the
     * default catalog currency when they have none.
     */
    ComplimentaryGrant grantComplimentary(UUID memberId) throws StripeException;

    /**
     * Cancel every subscription of the member that is not already canceled. Best effort: a failure on
     * one subscription is logged and recorded, and the rest are still attempted.
     *
     * @return one outcome per subscription attempted
     */
    List<ReconciliationOutcome> cancelComplimentary(UUID memberId);

    /**
     * Mirrored subscriptions of the member.
     */
    List<StripeCustomerSubscription> getSubscriptions(UUID memberId);
}
