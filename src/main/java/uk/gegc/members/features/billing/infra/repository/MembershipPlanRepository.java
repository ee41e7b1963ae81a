package uk.gegc.members.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.members.features.billing.domain.model.MembershipPlan;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface MembershipPlanRepository extends JpaRepository<MembershipPlan, UUID> {
    Optional<MembershipPlan> findByStripePriceId(String stripePriceId);

    List<MembershipPlan> findByActiveTrue();

    List<MembershipPlan> findByActiveTrueAndComplimentaryTrueAndCurrency(String currency);
}
