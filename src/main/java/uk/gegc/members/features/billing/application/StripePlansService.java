package uk.gegc.members.features.billing.application;

import uk.gegc.members.features.billing.domain.model.MembershipPlan;

import java.util.List;
import java.util.Optional;

/**
 * Catalog of the membership plans available for subscriptions.
 */
public interface StripePlansService {

    /**
     * Active plans, cheapest first.
     */
    List<MembershipPlan> getPlans();

    /**
     * The complimentary plan for a currency (case-insensitive), if the catalog has one.
     */
    Optional<MembershipPlan> getComplimentaryPlan(String currency);
}
