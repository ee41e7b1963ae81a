package uk.gegc.members.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.members.features.billing.domain.model.StripeCustomer;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for Stripe customers linked to members.
 */
public interface StripeCustomerRepository extends JpaRepository<StripeCustomer, Long> {

    Optional<StripeCustomer> findByCustomerId(String customerId);

    /**
     * Customers of a member in stored order.
     */
    List<StripeCustomer> findByMemberIdOrderByCreatedAtAscIdAsc(UUID memberId);

    Optional<StripeCustomer> findByMemberIdAndCustomerId(UUID memberId, String customerId);

    void deleteByMemberId(UUID memberId);
}
