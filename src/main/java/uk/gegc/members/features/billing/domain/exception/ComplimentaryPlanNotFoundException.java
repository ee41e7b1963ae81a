package uk.gegc.members.features.billing.domain.exception;

/**
 * Thrown when the plan catalog has no complimentary plan for the currency a grant needs.
 */
public class ComplimentaryPlanNotFoundException extends RuntimeException {

    private final String currency;

    public ComplimentaryPlanNotFoundException(String currency) {
        this(currency, "Could not find Complimentary plan for currency " + currency);
    }

    private ComplimentaryPlanNotFoundException(String currency, String message) {
        super(message);
        this.currency = currency;
    }

    /**
     * No currency could be chosen because the catalog has no plan billed at the given interval.
     */
    public static ComplimentaryPlanNotFoundException noPlanForInterval(String interval) {
        return new ComplimentaryPlanNotFoundException(null,
                "Could not find Complimentary plan: no plan with interval '" + interval
                        + "' to take a default currency from");
    }

    /**
     * May be null when no currency could be chosen.
     */
    public String getCurrency() {
        return currency;
    }
}
