package uk.gegc.members.features.billing.domain.exception;

import java.util.UUID;

/**
 * Thrown when a subscription refers to a Stripe customer that is not linked to the member.
 */
public class UnlinkedCustomerException extends RuntimeException {

    private final UUID memberId;
    private final String customerId;
    private final String subscriptionId;

    public UnlinkedCustomerException(UUID memberId, String customerId, String subscriptionId) {
        super(String.format("Subscription %s is not associated with a customer for member %s (customer %s)",
                subscriptionId, memberId, customerId));
        this.memberId = memberId;
        this.customerId = customerId;
        this.subscriptionId = subscriptionId;
    }

    public UUID getMemberId() {
        return memberId;
    }

    public String getCustomerId() {
        return customerId;
    }

    public String getSubscriptionId() {
        return subscriptionId;
    }
}
