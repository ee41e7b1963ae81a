package uk.gegc.members.features.billing.application;

/**
 * Service responsible for synchronizing MembershipPlan records with recurring Stripe Prices.
 */
public interface StripePlanSyncService {

    /**
     * Synchronize local plans with active recurring Stripe prices, deactivating plans whose price
     * is no longer active.
     * <p>
     * Implementation should be idempotent and safe to call frequently.
     */
    void syncActivePlans();
}
