package uk.gegc.members.features.billing.api.dto;

import uk.gegc.members.features.billing.domain.model.StripeCustomerSubscription;

import java.time.Instant;

public record SubscriptionDto(
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

    public static SubscriptionDto from(StripeCustomerSubscription subscription) {
        return new SubscriptionDto(
                subscription.getSubscriptionId(),
                subscription.getCustomerId(),
                subscription.getStatus(),
                subscription.isCancelAtPeriodEnd(),
                subscription.getCancellationReason(),
                subscription.getCurrentPeriodEnd(),
                subscription.getStartDate(),
                subscription.getDefaultPaymentCardLast4(),
                subscription.getPlanId(),
                subscription.getPlanNickname(),
                subscription.getPlanInterval(),
                subscription.getPlanAmount(),
                subscription.getPlanCurrency()
        );
    }
}
