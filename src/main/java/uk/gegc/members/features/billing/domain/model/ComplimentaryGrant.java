package uk.gegc.members.features.billing.domain.model;

import java.util.List;

/**
 * What a complimentary grant did: the plan and currency chosen, the customer used,
 * the subscriptions created or moved to the plan, and how each stored customer probed.
 */
public record ComplimentaryGrant(
        String currency,
        String planId,
        String customerId,
        boolean customerCreated,
        List<String> subscriptionIds,
        List<ReconciliationOutcome> customerProbes
) {
}
