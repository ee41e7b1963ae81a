package uk.gegc.members.features.billing.application;

import uk.gegc.members.features.billing.domain.model.StripeCustomer;
import uk.gegc.members.features.billing.domain.model.StripeCustomerSubscription;
import uk.gegc.members.features.billing.domain.model.SubscriptionSnapshot;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Local mirror of the Stripe customers and subscriptions linked to members.
 * Each write commits on its own.
 */
public interface StripeMirrorStore {

    List<StripeCustomer> findCustomers(UUID memberId);

    Optional<StripeCustomer> findCustomer(UUID memberId, String customerId);

    List<StripeCustomerSubscription> findSubscriptions(UUID memberId);

    List<StripeCustomerSubscription> findCustomerSubscriptions(String customerId);

    Optional<StripeCustomerSubscription> findSubscription(UUID memberId, String subscriptionId);

    /**
     * Insert a customer row. Never updates an existing row for the same Stripe customer.
     *
     * @throws uk.gegc.members.features.billing.domain.exception.CustomerAlreadyLinkedException if the
     *         customer already has a row
     */
    StripeCustomer addCustomer(UUID memberId, String customerId, String name, String email);

    /**
     * Insert or update the customer row keyed by {@code customerId}.
     */
    StripeCustomer upsertCustomer(UUID memberId, String customerId, String name, String email);

    void updateCustomerEmail(String customerId, String email);

    /**
     * Insert or overwrite the subscription row keyed by {@code subscriptionId}.
     */
    StripeCustomerSubscription upsertSubscription(SubscriptionSnapshot snapshot);

    /**
     * Update only the cancel-at-period-end flag of an existing row.
     */
    StripeCustomerSubscription updateCancelAtPeriodEnd(Long id, boolean cancelAtPeriodEnd);

    /**
     * Delete every customer and subscription row of a member.
     */
    void deleteMemberRecords(UUID memberId);
}
