package uk.gegc.members.features.billing.domain.model;

/**
 * Result of one item of a best-effort loop: either succeeded, or failed with the captured error.
 */
public record ReconciliationOutcome(String itemId, boolean succeeded, String detail, Exception error) {

    public static ReconciliationOutcome success(String itemId, String detail) {
        return new ReconciliationOutcome(itemId, true, detail, null);
    }

    public static ReconciliationOutcome failure(String itemId, String detail, Exception error) {
        return new ReconciliationOutcome(itemId, false, detail, error);
    }
}
