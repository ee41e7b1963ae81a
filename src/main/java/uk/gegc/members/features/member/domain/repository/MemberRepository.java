package uk.gegc.members.features.member.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.members.features.member.domain.model.Member;

import java.util.Optional;
import java.util.UUID;

public interface MemberRepository extends JpaRepository<Member, UUID> {

    Optional<Member> findByEmail(String email);

    boolean existsByEmail(String email);

    /**
     * Resolve the member owning a linked Stripe customer.
     */
    @Query("select m from Member m where m.id = " +
            "(select c.memberId from StripeCustomer c where c.customerId = :customerId)")
    Optional<Member> findByStripeCustomerId(@Param("customerId") String customerId);
}
