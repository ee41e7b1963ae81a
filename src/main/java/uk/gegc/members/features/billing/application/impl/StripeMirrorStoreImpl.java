package uk.gegc.members.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.members.features.billing.application.StripeMirrorStore;
import uk.gegc.members.features.billing.domain.exception.CustomerAlreadyLinkedException;
import uk.gegc.members.features.billing.domain.model.StripeCustomer;
import uk.gegc.members.features.billing.domain.model.StripeCustomerSubscription;
import uk.gegc.members.features.billing.domain.model.SubscriptionSnapshot;
import uk.gegc.members.features.billing.infra.repository.StripeCustomerRepository;
import uk.gegc.members.features.billing.infra.repository.StripeCustomerSubscriptionRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

@Slf4j
@Service
@RequiredArgsConstructor
public class StripeMirrorStoreImpl implements StripeMirrorStore {

    private final StripeCustomerRepository customerRepository;
    private final StripeCustomerSubscriptionRepository subscriptionRepository;
    private final TransactionTemplate transactionTemplate;

    @Override
    @Transactional(readOnly = true)
    public List<StripeCustomer> findCustomers(UUID memberId) {
        return customerRepository.findByMemberIdOrderByCreatedAtAscIdAsc(memberId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<StripeCustomer> findCustomer(UUID memberId, String customerId) {
        return customerRepository.findByMemberIdAndCustomerId(memberId, customerId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<StripeCustomerSubscription> findSubscriptions(UUID memberId) {
        return subscriptionRepository.findByMemberId(memberId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<StripeCustomerSubscription> findCustomerSubscriptions(String customerId) {
        return subscriptionRepository.findByCustomerIdOrderByIdAsc(customerId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<StripeCustomerSubscription> findSubscription(UUID memberId, String subscriptionId) {
        return subscriptionRepository.findByMemberIdAndSubscriptionId(memberId, subscriptionId);
    }

    @Override
    @Transactional
    public StripeCustomer addCustomer(UUID memberId, String customerId, String name, String email) {
        customerRepository.findByCustomerId(customerId).ifPresent(existing -> {
            throw new CustomerAlreadyLinkedException(customerId, existing.getMemberId());
        });

        StripeCustomer customer = new StripeCustomer();
        customer.setCustomerId(customerId);
        customer.setMemberId(memberId);
        customer.setName(name);
        customer.setEmail(email);
        StripeCustomer saved = customerRepository.saveAndFlush(customer);

        log.info("Linked Stripe customer {} to member {}", customerId, memberId);
        return saved;
    }

    @Override
    public StripeCustomer upsertCustomer(UUID memberId, String customerId, String name, String email) {
        return writeWithConflictRetry("customer " + customerId, () -> {
            StripeCustomer customer = customerRepository.findByCustomerId(customerId)
                    .orElseGet(StripeCustomer::new);
            customer.setCustomerId(customerId);
            customer.setMemberId(memberId);
            customer.setName(name);
            customer.setEmail(email);
            return customerRepository.saveAndFlush(customer);
        });
    }

    @Override
    @Transactional
    public void updateCustomerEmail(String customerId, String email) {
        customerRepository.findByCustomerId(customerId).ifPresent(customer -> {
            customer.setEmail(email);
            customerRepository.save(customer);
        });
    }

    @Override
    public StripeCustomerSubscription upsertSubscription(SubscriptionSnapshot snapshot) {
        return writeWithConflictRetry("subscription " + snapshot.subscriptionId(), () -> writeSubscription(snapshot));
    }

    private StripeCustomerSubscription writeSubscription(SubscriptionSnapshot snapshot) {
        StripeCustomerSubscription subscription = subscriptionRepository.findBySubscriptionId(snapshot.subscriptionId())
                .orElseGet(StripeCustomerSubscription::new);
        boolean isNew = subscription.getId() == null;

        subscription.setSubscriptionId(snapshot.subscriptionId());
        subscription.setCustomerId(snapshot.customerId());
        subscription.setStatus(snapshot.status());
        subscription.setCancelAtPeriodEnd(snapshot.cancelAtPeriodEnd());
        subscription.setCancellationReason(snapshot.cancellationReason());
        subscription.setCurrentPeriodEnd(snapshot.currentPeriodEnd());
        subscription.setStartDate(snapshot.startDate());
        subscription.setDefaultPaymentCardLast4(snapshot.defaultPaymentCardLast4());
        subscription.setPlanId(snapshot.planId());
        subscription.setPlanNickname(snapshot.planNickname());
        subscription.setPlanInterval(snapshot.planInterval());
        subscription.setPlanAmount(snapshot.planAmount());
        subscription.setPlanCurrency(snapshot.planCurrency());

        StripeCustomerSubscription saved = subscriptionRepository.saveAndFlush(subscription);
        log.debug("{} mirrored subscription {} (status={}, plan={})",
                isNew ? "Inserted" : "Updated", snapshot.subscriptionId(), snapshot.status(), snapshot.planId());
        return saved;
    }

    @Override
    @Transactional
    public StripeCustomerSubscription updateCancelAtPeriodEnd(Long id, boolean cancelAtPeriodEnd) {
        StripeCustomerSubscription subscription = subscriptionRepository.findById(id)
                .orElseThrow(() -> new IllegalStateException("Mirrored subscription row " + id + " disappeared"));
        subscription.setCancelAtPeriodEnd(cancelAtPeriodEnd);
        return subscriptionRepository.save(subscription);
    }

    @Override
    @Transactional
    public void deleteMemberRecords(UUID memberId) {
        int subscriptions = subscriptionRepository.deleteByMemberId(memberId);
        customerRepository.deleteByMemberId(memberId);
        log.info("Deleted Stripe mirror records of member {} ({} subscriptions)", memberId, subscriptions);
    }

    /**
     * Runs an upsert in its own transaction. When a concurrent writer inserted the same key first, the
     * unique constraint rejects our insert; the second attempt reads that row and overwrites it.
     */
    private <T> T writeWithConflictRetry(String key, Supplier<T> write) {
        try {
            return transactionTemplate.execute(status -> write.get());
        } catch (DataIntegrityViolationException e) {
            log.info("Mirrored {} was inserted concurrently; retrying as an update", key);
            return transactionTemplate.execute(status -> write.get());
        }
    }
}
