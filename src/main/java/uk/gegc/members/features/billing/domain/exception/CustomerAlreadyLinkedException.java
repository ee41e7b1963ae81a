package uk.gegc.members.features.billing.domain.exception;

import java.util.UUID;

/**
 * Thrown when linking a Stripe customer that already has a local record.
 * Linking never reassigns an existing customer.
 */
public class CustomerAlreadyLinkedException extends RuntimeException {

    private final String customerId;
    private final UUID linkedMemberId;

    public CustomerAlreadyLinkedException(String customerId, UUID linkedMemberId) {
        super("Stripe customer " + customerId + " is already linked to member " + linkedMemberId);
        this.customerId = customerId;
        this.linkedMemberId = linkedMemberId;
    }

    public String getCustomerId() {
        return customerId;
    }

    public UUID getLinkedMemberId() {
        return linkedMemberId;
    }
}
