package uk.gegc.members.features.billing.domain.model;

import com.stripe.model.PaymentMethod;
import com.stripe.model.Subscription;

/**
 * The {@code default_payment_method} of a Stripe subscription, which is either absent,
 * a bare id, or an expanded object.
 */
public sealed interface DefaultPaymentMethod
        permits DefaultPaymentMethod.Unset, DefaultPaymentMethod.IdReference, DefaultPaymentMethod.Expanded {

    static DefaultPaymentMethod of(Subscription subscription) {
        PaymentMethod expanded = subscription.getDefaultPaymentMethodObject();
        if (expanded != null) {
            return new Expanded(expanded);
        }
        String id = subscription.getDefaultPaymentMethod();
        if (id != null && !id.isBlank()) {
            return new IdReference(id);
        }
        return new Unset();
    }

    record Unset() implements DefaultPaymentMethod {
    }

    record IdReference(String id) implements DefaultPaymentMethod {
    }

    record Expanded(PaymentMethod paymentMethod) implements DefaultPaymentMethod {
    }
}
