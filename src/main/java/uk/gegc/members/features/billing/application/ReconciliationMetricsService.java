package uk.gegc.members.features.billing.application;

/**
 * Metrics for member reconciliation with Stripe.
 */
public interface ReconciliationMetricsService {

    void recordOperation(String operation, boolean succeeded);

    /**
     * An item of a best-effort loop failed and was skipped.
     */
    void recordBestEffortFailure(String operation);
}
