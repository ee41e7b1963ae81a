package uk.gegc.members.features.billing.application.impl;

import com.stripe.exception.StripeException;
import com.stripe.model.Customer;
import com.stripe.model.PaymentMethod;
import com.stripe.model.Price;
import com.stripe.model.Subscription;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.members.features.billing.application.BillingProperties;
import uk.gegc.members.features.billing.application.MemberSubscriptionService;
import uk.gegc.members.features.billing.application.ReconciliationLoggingContext;
import uk.gegc.members.features.billing.application.ReconciliationMetricsService;
import uk.gegc.members.features.billing.application.StripeMirrorStore;
import uk.gegc.members.features.billing.application.StripePlansService;
import uk.gegc.members.features.billing.application.StripeService;
import uk.gegc.members.features.billing.domain.exception.ComplimentaryPlanNotFoundException;
import uk.gegc.members.features.billing.domain.exception.StripeNotConfiguredException;
import uk.gegc.members.features.billing.domain.exception.SubscriptionNotFoundException;
import uk.gegc.members.features.billing.domain.exception.UnlinkedCustomerException;
import uk.gegc.members.features.billing.domain.model.ComplimentaryGrant;
import uk.gegc.members.features.billing.domain.model.DefaultPaymentMethod;
import uk.gegc.members.features.billing.domain.model.MembershipPlan;
import uk.gegc.members.features.billing.domain.model.ReconciliationOutcome;
import uk.gegc.members.features.billing.domain.model.StripeCustomer;
import uk.gegc.members.features.billing.domain.model.StripeCustomerSubscription;
import uk.gegc.members.features.billing.domain.model.SubscriptionSnapshot;
import uk.gegc.members.features.member.domain.exception.MemberNotFoundException;
import uk.gegc.members.features.member.domain.model.Member;
import uk.gegc.members.features.member.domain.repository.MemberRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Sequential reconciliation of members with Stripe. No transaction spans an operation: every mirror
 * write commits as soon as the Stripe call it reflects has succeeded, so a failure part way through
 * leaves the earlier writes in place.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MemberSubscriptionServiceImpl implements MemberSubscriptionService {

    static final String LINK_CUSTOMER = "link_customer";
    static final String LINK_SUBSCRIPTION = "link_subscription";
    static final String UPDATE_CANCELLATION = "update_subscription_cancellation";
    static final String GRANT_COMPLIMENTARY = "grant_complimentary";
    static final String CANCEL_COMPLIMENTARY = "cancel_complimentary";
    static final String PROBE_CUSTOMER = "probe_customer";

    private static final String CANCELLATION_REASON = "cancellation_reason";

    private final StripeService stripeService;
    private final StripePlansService stripePlansService;
    private final StripeMirrorStore mirrorStore;
    private final MemberRepository memberRepository;
    private final BillingProperties billingProperties;
    private final ReconciliationMetricsService metricsService;

    @Override
    public Optional<StripeCustomer> linkCustomer(UUID memberId, String customerId) throws StripeException {
        requireConfigured("link Stripe Customer");
        ReconciliationLoggingContext context = context(LINK_CUSTOMER, memberId).withCustomer(customerId);
        try {
            requireMember(memberId);

            Optional<Customer> remote = stripeService.getCustomer(customerId);
            if (remote.isEmpty()) {
                context.logInfo(log, "Stripe customer {} not found; nothing linked to member {}", customerId, memberId);
                metricsService.recordOperation(LINK_CUSTOMER, true);
                return Optional.empty();
            }
            Customer customer = remote.get();

            StripeCustomer linked = mirrorStore.addCustomer(memberId, customerId, customer.getName(), customer.getEmail());

            List<Subscription> subscriptions = customer.getSubscriptions() != null && customer.getSubscriptions().getData() != null
                    ? customer.getSubscriptions().getData()
                    : List.of();
            for (Subscription subscription : subscriptions) {
                mirrorSubscription(memberId, subscription, context.withSubscription(subscription.getId()));
            }

            context.logInfo(log, "Linked Stripe customer {} with {} subscription(s) to member {}",
                    customerId, subscriptions.size(), memberId);
            metricsService.recordOperation(LINK_CUSTOMER, true);
            return Optional.of(linked);
        } catch (StripeException | RuntimeException e) {
            metricsService.recordOperation(LINK_CUSTOMER, false);
            throw e;
        }
    }

    @Override
    public StripeCustomerSubscription linkSubscription(UUID memberId, Subscription subscription) throws StripeException {
        requireConfigured("link Stripe Subscription");
        ReconciliationLoggingContext context = context(LINK_SUBSCRIPTION, memberId)
                .withCustomer(subscription.getCustomer())
                .withSubscription(subscription.getId());
        try {
            StripeCustomerSubscription mirrored = mirrorSubscription(memberId, subscription, context);
            metricsService.recordOperation(LINK_SUBSCRIPTION, true);
            return mirrored;
        } catch (StripeException | RuntimeException e) {
            metricsService.recordOperation(LINK_SUBSCRIPTION, false);
            throw e;
        }
    }

    @Override
    public StripeCustomerSubscription updateSubscriptionCancellation(UUID memberId, String subscriptionId,
                                                                     Boolean cancelAtPeriodEnd) throws StripeException {
        requireConfigured("update Stripe Subscription");
        if (cancelAtPeriodEnd == null) {
            throw new IllegalArgumentException("cancelAtPeriodEnd must be provided as true or false");
        }
        ReconciliationLoggingContext context = context(UPDATE_CANCELLATION, memberId).withSubscription(subscriptionId);
        try {
            StripeCustomerSubscription subscription = mirrorStore.findSubscription(memberId, subscriptionId)
                    .orElseThrow(() -> new SubscriptionNotFoundException(memberId, subscriptionId));

            if (cancelAtPeriodEnd) {
                stripeService.cancelSubscriptionAtPeriodEnd(subscriptionId);
            } else {
                stripeService.continueSubscriptionAtPeriodEnd(subscriptionId);
            }

            StripeCustomerSubscription updated = mirrorStore.updateCancelAtPeriodEnd(subscription.getId(), cancelAtPeriodEnd);
            context.logInfo(log, "Subscription {} cancel_at_period_end set to {}", subscriptionId, cancelAtPeriodEnd);
            metricsService.recordOperation(UPDATE_CANCELLATION, true);
            return updated;
        } catch (StripeException | RuntimeException e) {
            metricsService.recordOperation(UPDATE_CANCELLATION, false);
            throw e;
        }
    }

    @Override
    public ComplimentaryGrant grantComplimentary(UUID memberId) throws StripeException {
        requireConfigured("update Stripe Subscription");
        ReconciliationLoggingContext context = context(GRANT_COMPLIMENTARY, memberId);
        try {
            Member member = requireMember(memberId);

            List<StripeCustomerSubscription> activeSubscriptions = mirrorStore.findSubscriptions(memberId).stream()
                    .filter(StripeCustomerSubscription::isActiveLike)
                    .toList();

            // Stripe does not let a customer switch currency, so the grant keeps the currency of
            // the subscription the member already holds.
            String currency = resolveComplimentaryCurrency(activeSubscriptions);
            MembershipPlan plan = stripePlansService.getComplimentaryPlan(currency)
                    .orElseThrow(() -> new ComplimentaryPlanNotFoundException(currency));

            List<ReconciliationOutcome> probes = new ArrayList<>();
            Customer customer = findUsableCustomer(memberId, probes, context);
            boolean customerCreated = false;
            if (customer == null) {
                customer = stripeService.createCustomer(member.getEmail());
                mirrorStore.upsertCustomer(memberId, customer.getId(), customer.getName(), customer.getEmail());
                customerCreated = true;
                context.withCustomer(customer.getId())
                        .logInfo(log, "Created Stripe customer {} for member {}", customer.getId(), memberId);
            }

            List<String> subscriptionIds = new ArrayList<>();
            if (activeSubscriptions.isEmpty()) {
                Subscription created = stripeService.createSubscription(customer.getId(), plan.getStripePriceId());
                mirrorSubscription(memberId, created, context.withCustomer(customer.getId()).withSubscription(created.getId()));
                subscriptionIds.add(created.getId());
            } else {
                if (activeSubscriptions.size() > 1) {
                    context.logWarn(log, "Member {} has {} active subscriptions; moving all of them to the complimentary plan",
                            memberId, activeSubscriptions.size());
                }
                moveToPlan(memberId, activeSubscriptions, plan, subscriptionIds, context);
            }

            context.logInfo(log, "Granted complimentary plan {} ({}) to member {} on subscriptions {}",
                    plan.getStripePriceId(), currency, memberId, subscriptionIds);
            metricsService.recordOperation(GRANT_COMPLIMENTARY, true);
            return new ComplimentaryGrant(currency, plan.getStripePriceId(), customer.getId(), customerCreated,
                    List.copyOf(subscriptionIds), List.copyOf(probes));
        } catch (StripeException | RuntimeException e) {
            metricsService.recordOperation(GRANT_COMPLIMENTARY, false);
            throw e;
        }
    }

    @Override
    public List<ReconciliationOutcome> cancelComplimentary(UUID memberId) {
        requireConfigured("cancel Complimentary Subscription");
        ReconciliationLoggingContext context = context(CANCEL_COMPLIMENTARY, memberId);
        requireMember(memberId);

        List<ReconciliationOutcome> outcomes = new ArrayList<>();
        for (StripeCustomerSubscription subscription : mirrorStore.findSubscriptions(memberId)) {
            if (subscription.isCanceled()) {
                continue;
            }
            String subscriptionId = subscription.getSubscriptionId();
            ReconciliationLoggingContext subscriptionContext = context
                    .withCustomer(subscription.getCustomerId())
                    .withSubscription(subscriptionId);
            try {
                Subscription cancelled = stripeService.cancelSubscription(subscriptionId);
                StripeCustomerSubscription mirrored = mirrorSubscription(memberId, cancelled, subscriptionContext);
                outcomes.add(ReconciliationOutcome.success(subscriptionId, mirrored.getStatus()));
            } catch (StripeException | RuntimeException e) {
                subscriptionContext.logError(log, "There was an error cancelling subscription {}", subscriptionId, e);
                metricsService.recordBestEffortFailure(CANCEL_COMPLIMENTARY);
                outcomes.add(ReconciliationOutcome.failure(subscriptionId, e.getMessage(), e));
            }
        }

        long failed = outcomes.stream().filter(outcome -> !outcome.succeeded()).count();
        context.logInfo(log, "Cancelled complimentary access for member {}: {} attempted, {} failed",
                memberId, outcomes.size(), failed);
        metricsService.recordOperation(CANCEL_COMPLIMENTARY, true);
        return List.copyOf(outcomes);
    }

    @Override
    public List<StripeCustomerSubscription> getSubscriptions(UUID memberId) {
        requireMember(memberId);
        return mirrorStore.findSubscriptions(memberId);
    }

    private StripeCustomerSubscription mirrorSubscription(UUID memberId, Subscription remote,
                                                          ReconciliationLoggingContext context) throws StripeException {
        String customerId = remote.getCustomer();
        if (!StringUtils.hasText(customerId) || mirrorStore.findCustomer(memberId, customerId).isEmpty()) {
            throw new UnlinkedCustomerException(memberId, customerId, remote.getId());
        }

        Subscription subscription = stripeService.getSubscription(remote.getId());

        String cardLast4 = resolveCardLast4(DefaultPaymentMethod.of(subscription));
        Price price = primaryPrice(subscription);
        String interval = price.getRecurring() != null ? price.getRecurring().getInterval() : null;
        // Nickname is not nullable in the mirror; older plans without one fall back to their interval
        String nickname = StringUtils.hasText(price.getNickname()) ? price.getNickname() : interval;

        SubscriptionSnapshot snapshot = new SubscriptionSnapshot(
                subscription.getId(),
                subscription.getCustomer(),
                subscription.getStatus(),
                Boolean.TRUE.equals(subscription.getCancelAtPeriodEnd()),
                cancellationReason(subscription),
                toInstant(subscription.getCurrentPeriodEnd()),
                toInstant(subscription.getStartDate()),
                cardLast4,
                price.getId(),
                nickname,
                interval,
                price.getUnitAmount() != null ? price.getUnitAmount() : 0L,
                price.getCurrency()
        );

        StripeCustomerSubscription mirrored = mirrorStore.upsertSubscription(snapshot);
        context.logInfo(log, "Mirrored subscription {} (status={}, plan={})",
                subscription.getId(), subscription.getStatus(), price.getId());
        return mirrored;
    }

    private String resolveCardLast4(DefaultPaymentMethod defaultPaymentMethod) throws StripeException {
        String paymentMethodId;
        if (defaultPaymentMethod instanceof DefaultPaymentMethod.IdReference reference) {
            paymentMethodId = reference.id();
        } else if (defaultPaymentMethod instanceof DefaultPaymentMethod.Expanded expanded) {
            paymentMethodId = expanded.paymentMethod().getId();
        } else {
            return null;
        }

        Optional<PaymentMethod> paymentMethod = stripeService.getCardPaymentMethod(paymentMethodId);
        return paymentMethod
                .map(PaymentMethod::getCard)
                .map(PaymentMethod.Card::getLast4)
                .orElse(null);
    }

    private Customer findUsableCustomer(UUID memberId, List<ReconciliationOutcome> probes,
                                        ReconciliationLoggingContext context) {
        for (StripeCustomer candidate : mirrorStore.findCustomers(memberId)) {
            String customerId = candidate.getCustomerId();
            try {
                Optional<Customer> fetched = stripeService.getCustomer(customerId);
                if (fetched.isEmpty()) {
                    probes.add(ReconciliationOutcome.failure(customerId, "customer does not exist in Stripe", null));
                    continue;
                }
                if (Boolean.TRUE.equals(fetched.get().getDeleted())) {
                    probes.add(ReconciliationOutcome.failure(customerId, "customer is deleted in Stripe", null));
                    continue;
                }
                probes.add(ReconciliationOutcome.success(customerId, "usable"));
                return fetched.get();
            } catch (StripeException e) {
                context.withCustomer(customerId).logWarn(log,
                        "Ignoring error fetching Stripe customer {} for member {}: {}", customerId, memberId, e.getMessage(), e);
                metricsService.recordBestEffortFailure(PROBE_CUSTOMER);
                probes.add(ReconciliationOutcome.failure(customerId, e.getMessage(), e));
            }
        }
        return null;
    }

    private void moveToPlan(UUID memberId, List<StripeCustomerSubscription> subscriptions, MembershipPlan plan,
                            List<String> subscriptionIds, ReconciliationLoggingContext context) throws StripeException {
        List<Exception> failures = new ArrayList<>();
        for (StripeCustomerSubscription subscription : subscriptions) {
            String subscriptionId = subscription.getSubscriptionId();
            ReconciliationLoggingContext subscriptionContext = context
                    .withCustomer(subscription.getCustomerId())
                    .withSubscription(subscriptionId);
            try {
                Subscription updated = stripeService.changeSubscriptionPlan(subscriptionId, plan.getStripePriceId());
                mirrorSubscription(memberId, updated, subscriptionContext);
                subscriptionIds.add(subscriptionId);
            } catch (StripeException | RuntimeException e) {
                subscriptionContext.logError(log, "Failed to move subscription {} to complimentary plan {}",
                        subscriptionId, plan.getStripePriceId(), e);
                failures.add(e);
            }
        }

        if (failures.isEmpty()) {
            return;
        }
        Exception first = failures.get(0);
        for (Exception other : failures.subList(1, failures.size())) {
            first.addSuppressed(other);
        }
        if (first instanceof StripeException stripeException) {
            throw stripeException;
        }
        throw (RuntimeException) first;
    }

    private String resolveComplimentaryCurrency(List<StripeCustomerSubscription> activeSubscriptions) {
        if (!activeSubscriptions.isEmpty()) {
            return activeSubscriptions.get(0).getPlanCurrency().toLowerCase(Locale.ROOT);
        }
        String defaultInterval = billingProperties.getDefaultCurrencyInterval();
        return stripePlansService.getPlans().stream()
                .filter(plan -> defaultInterval.equals(plan.getInterval()))
                .findFirst()
                .map(plan -> plan.getCurrency().toLowerCase(Locale.ROOT))
                .orElseThrow(() -> ComplimentaryPlanNotFoundException.noPlanForInterval(defaultInterval));
    }

    private static Price primaryPrice(Subscription subscription) {
        if (subscription.getItems() == null || subscription.getItems().getData() == null
                || subscription.getItems().getData().isEmpty()
                || subscription.getItems().getData().get(0).getPrice() == null) {
            throw new IllegalStateException("Stripe subscription " + subscription.getId() + " has no plan");
        }
        return subscription.getItems().getData().get(0).getPrice();
    }

    private static String cancellationReason(Subscription subscription) {
        if (subscription.getMetadata() == null) {
            return null;
        }
        String reason = subscription.getMetadata().get(CANCELLATION_REASON);
        return StringUtils.hasText(reason) ? reason : null;
    }

    private static Instant toInstant(Long epochSeconds) {
        return epochSeconds != null ? Instant.ofEpochSecond(epochSeconds) : null;
    }

    private void requireConfigured(String operation) {
        if (!stripeService.isConfigured()) {
            throw new StripeNotConfiguredException(operation);
        }
    }

    private Member requireMember(UUID memberId) {
        return memberRepository.findById(memberId)
                .orElseThrow(() -> new MemberNotFoundException(memberId));
    }

    private static ReconciliationLoggingContext context(String operation, UUID memberId) {
        return ReconciliationLoggingContext.builder()
                .operation(operation)
                .memberId(memberId)
                .build();
    }
}
