package uk.gegc.members.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.members.features.billing.domain.model.StripeCustomerSubscription;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for mirrored Stripe subscriptions.
 */
public interface StripeCustomerSubscriptionRepository extends JpaRepository<StripeCustomerSubscription, Long> {

    Optional<StripeCustomerSubscription> findBySubscriptionId(String subscriptionId);

    List<StripeCustomerSubscription> findByCustomerIdOrderByIdAsc(String customerId);

    /**
     * Subscriptions of every customer linked to the member.
     */
    @Query("select s from StripeCustomerSubscription s where s.customerId in " +
            "(select c.customerId from StripeCustomer c where c.memberId = :memberId) order by s.id asc")
    List<StripeCustomerSubscription> findByMemberId(@Param("memberId") UUID memberId);

    @Query("select s from StripeCustomerSubscription s where s.subscriptionId = :subscriptionId and s.customerId in " +
            "(select c.customerId from StripeCustomer c where c.memberId = :memberId)")
    Optional<StripeCustomerSubscription> findByMemberIdAndSubscriptionId(@Param("memberId") UUID memberId,
                                                                         @Param("subscriptionId") String subscriptionId);

    @Modifying
    @Query("delete from StripeCustomerSubscription s where s.customerId in " +
            "(select c.customerId from StripeCustomer c where c.memberId = :memberId)")
    int deleteByMemberId(@Param("memberId") UUID memberId);
}
