package uk.gegc.members.features.billing.domain.model;

import java.time.Instant;

/**
 * Field values of a Stripe subscription as they are written to the mirror.
 */
public record SubscriptionSnapshot(
        String subscriptionId,
        String customerId,
        String status,
        boolean cancelAtPeriodEnd,
        String cancellationReason,
        Instant currentPeriodEnd,
        Instant startDate,
        String defaultPaymentCardLast4,
        String planId,
        String planNickname,
        String planInterval,
        long planAmount,
        String planCurrency
) {
}
