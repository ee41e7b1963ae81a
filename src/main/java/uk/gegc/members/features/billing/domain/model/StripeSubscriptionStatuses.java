package uk.gegc.members.features.billing.domain.model;

import java.util.Set;

/**
 * Stripe subscription status values the reconciliation logic cares about.
 * Any other status string is stored as received.
 */
public final class StripeSubscriptionStatuses {

    public static final String ACTIVE = "active";
    public static final String TRIALING = "trialing";
    public static final String UNPAID = "unpaid";
    public static final String PAST_DUE = "past_due";
    public static final String CANCELED = "canceled";

    /** Statuses that hold the member's subscription slot. */
    public static final Set<String> ACTIVE_LIKE = Set.of(ACTIVE, TRIALING, UNPAID, PAST_DUE);

    private StripeSubscriptionStatuses() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static boolean isActiveLike(String status) {
        return status != null && ACTIVE_LIKE.contains(status);
    }
}
