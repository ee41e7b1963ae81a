package uk.gegc.members.features.billing.domain.exception;

/**
 * Thrown when a Stripe-dependent operation is attempted without a Stripe connection.
 */
public class StripeNotConfiguredException extends RuntimeException {

    private final String operation;

    public StripeNotConfiguredException(String operation) {
        super("Cannot " + operation + " with no Stripe connection");
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
