package uk.gegc.members.features.billing.domain.exception;

import java.util.UUID;

public class SubscriptionNotFoundException extends RuntimeException {

    private final String subscriptionId;

    public SubscriptionNotFoundException(UUID memberId, String subscriptionId) {
        super("Subscription " + subscriptionId + " not found for member " + memberId);
        this.subscriptionId = subscriptionId;
    }

    public String getSubscriptionId() {
        return subscriptionId;
    }
}
