package uk.gegc.members.features.billing.application.impl;

import com.stripe.exception.ApiConnectionException;
import com.stripe.exception.StripeException;
import com.stripe.model.Customer;
import com.stripe.model.PaymentMethod;
import com.stripe.model.Price;
import com.stripe.model.Subscription;
import com.stripe.model.SubscriptionCollection;
import com.stripe.model.SubscriptionItem;
import com.stripe.model.SubscriptionItemCollection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.members.features.billing.application.BillingProperties;
import uk.gegc.members.features.billing.application.ReconciliationMetricsService;
import uk.gegc.members.features.billing.application.StripeMirrorStore;
import uk.gegc.members.features.billing.application.StripePlansService;
import uk.gegc.members.features.billing.application.StripeService;
import uk.gegc.members.features.billing.domain.exception.ComplimentaryPlanNotFoundException;
import uk.gegc.members.features.billing.domain.exception.StripeNotConfiguredException;
import uk.gegc.members.features.billing.domain.exception.SubscriptionNotFoundException;
import uk.gegc.members.features.billing.domain.exception.UnlinkedCustomerException;
import uk.gegc.members.features.billing.domain.model.ComplimentaryGrant;
import uk.gegc.members.features.billing.domain.model.MembershipPlan;
import uk.gegc.members.features.billing.domain.model.ReconciliationOutcome;
import uk.gegc.members.features.billing.domain.model.StripeCustomer;
import uk.gegc.members.features.billing.domain.model.StripeCustomerSubscription;
import uk.gegc.members.features.billing.domain.model.SubscriptionSnapshot;
import uk.gegc.members.features.member.domain.exception.MemberNotFoundException;
import uk.gegc.members.features.member.domain.model.Member;
import uk.gegc.members.features.member.domain.repository.MemberRepository;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("MemberSubscriptionService Tests")
class MemberSubscriptionServiceImplTest {

    private static final long PERIOD_END = 1_735_689_600L;
    private static final long START_DATE = 1_704_067_200L;

    @Mock
    private StripeService stripeService;

    @Mock
    private StripePlansService stripePlansService;

    @Mock
    private StripeMirrorStore mirrorStore;

    @Mock
    private MemberRepository memberRepository;

    @Mock
    private ReconciliationMetricsService metricsService;

    private MemberSubscriptionServiceImpl service;

    private UUID memberId;
    private Member member;
    private BillingProperties billingProperties;

    @BeforeEach
    void setUp() {
        billingProperties = new BillingProperties();
        service = new MemberSubscriptionServiceImpl(
                stripeService, stripePlansService, mirrorStore, memberRepository, billingProperties, metricsService);

        memberId = UUID.randomUUID();
        member = new Member();
        member.setId(memberId);
        member.setEmail("reader@example.com");

        lenient().when(stripeService.isConfigured()).thenReturn(true);
        lenient().when(memberRepository.findById(memberId)).thenReturn(Optional.of(member));
        lenient().when(mirrorStore.upsertSubscription(any(SubscriptionSnapshot.class)))
                .thenAnswer(invocation -> mirrored(invocation.getArgument(0)));
    }

    @Nested
    @DisplayName("Stripe configuration guard")
    class ConfigurationGuardTests {

        @BeforeEach
        void unconfigure() {
            when(stripeService.isConfigured()).thenReturn(false);
        }

        @Test
        @DisplayName("linkCustomer fails before touching Stripe or the mirror")
        void linkCustomer_notConfigured_throwsWithoutSideEffects() {
            assertThatThrownBy(() -> service.linkCustomer(memberId, "cus_1"))
                    .isInstanceOf(StripeNotConfiguredException.class)
                    .hasMessage("Cannot link Stripe Customer with no Stripe connection");

            verify(stripeService, only()).isConfigured();
            verifyNoInteractions(mirrorStore, memberRepository, stripePlansService);
        }

        @Test
        @DisplayName("linkSubscription fails before touching Stripe or the mirror")
        void linkSubscription_notConfigured_throwsWithoutSideEffects() {
            Subscription subscription = subscription("sub_1", "cus_1", "active", "price_1", "Monthly", "month", 500L, "usd");

            assertThatThrownBy(() -> service.linkSubscription(memberId, subscription))
                    .isInstanceOf(StripeNotConfiguredException.class)
                    .hasMessageContaining("link Stripe Subscription");

            verify(stripeService, only()).isConfigured();
            verifyNoInteractions(mirrorStore, memberRepository);
        }

        @Test
        @DisplayName("updateSubscriptionCancellation fails even when the flag is missing")
        void updateSubscriptionCancellation_notConfigured_guardComesFirst() {
            assertThatThrownBy(() -> service.updateSubscriptionCancellation(memberId, "sub_1", null))
                    .isInstanceOf(StripeNotConfiguredException.class);

            verify(stripeService, only()).isConfigured();
            verifyNoInteractions(mirrorStore);
        }

        @Test
        @DisplayName("grantComplimentary and cancelComplimentary fail before any read")
        void complimentaryOperations_notConfigured_throwWithoutSideEffects() {
            assertThatThrownBy(() -> service.grantComplimentary(memberId))
                    .isInstanceOf(StripeNotConfiguredException.class);
            assertThatThrownBy(() -> service.cancelComplimentary(memberId))
                    .isInstanceOf(StripeNotConfiguredException.class)
                    .hasMessage("Cannot cancel Complimentary Subscription with no Stripe connection");

            verify(stripeService, times(2)).isConfigured();
            verifyNoMoreInteractions(stripeService);
            verifyNoInteractions(mirrorStore, memberRepository, stripePlansService);
        }
    }

    @Nested
    @DisplayName("linkSubscription Tests")
    class LinkSubscriptionTests {

        @Test
        @DisplayName("should reject a subscription whose customer is not linked to the member")
        void linkSubscription_unlinkedCustomer_throwsAndWritesNothing() throws StripeException {
            // Given
            Subscription remote = subscription("sub_1", "cus_other", "active", "price_1", "Monthly", "month", 500L, "usd");
            when(mirrorStore.findCustomer(memberId, "cus_other")).thenReturn(Optional.empty());

            // When / Then
            assertThatThrownBy(() -> service.linkSubscription(memberId, remote))
                    .isInstanceOf(UnlinkedCustomerException.class)
                    .hasMessageContaining("sub_1");

            verify(stripeService, never()).getSubscription(anyString());
            verify(mirrorStore, never()).upsertSubscription(any());
            verify(metricsService).recordOperation(MemberSubscriptionServiceImpl.LINK_SUBSCRIPTION, false);
        }

        @Test
        @DisplayName("should mirror the re-fetched subscription with card last4 from an id reference")
        void linkSubscription_paymentMethodReference_mirrorsCardLast4() throws StripeException {
            // Given
            Subscription stale = subscription("sub_1", "cus_1", "incomplete", "price_old", "Old", "month", 100L, "usd");
            Subscription fresh = subscription("sub_1", "cus_1", "active", "price_1", "Monthly", "month", 500L, "usd");
            fresh.setDefaultPaymentMethod("pm_1");
            fresh.setCancelAtPeriodEnd(true);
            fresh.setMetadata(Map.of("cancellation_reason", "Too expensive"));

            linkedCustomer("cus_1");
            when(stripeService.getSubscription("sub_1")).thenReturn(fresh);
            when(stripeService.getCardPaymentMethod("pm_1")).thenReturn(Optional.of(card("pm_1", "4242")));

            // When
            StripeCustomerSubscription result = service.linkSubscription(memberId, stale);

            // Then
            SubscriptionSnapshot snapshot = capturedSnapshot();
            assertThat(snapshot.subscriptionId()).isEqualTo("sub_1");
            assertThat(snapshot.customerId()).isEqualTo("cus_1");
            assertThat(snapshot.status()).isEqualTo("active");
            assertThat(snapshot.cancelAtPeriodEnd()).isTrue();
            assertThat(snapshot.cancellationReason()).isEqualTo("Too expensive");
            assertThat(snapshot.currentPeriodEnd()).isEqualTo(Instant.ofEpochSecond(PERIOD_END));
            assertThat(snapshot.startDate()).isEqualTo(Instant.ofEpochSecond(START_DATE));
            assertThat(snapshot.defaultPaymentCardLast4()).isEqualTo("4242");
            assertThat(snapshot.planId()).isEqualTo("price_1");
            assertThat(snapshot.planNickname()).isEqualTo("Monthly");
            assertThat(snapshot.planInterval()).isEqualTo("month");
            assertThat(snapshot.planAmount()).isEqualTo(500L);
            assertThat(snapshot.planCurrency()).isEqualTo("usd");
            assertThat(result.getStatus()).isEqualTo("active");
            verify(metricsService).recordOperation(MemberSubscriptionServiceImpl.LINK_SUBSCRIPTION, true);
        }

        @Test
        @DisplayName("should fetch the card of an expanded payment method by its id")
        void linkSubscription_expandedPaymentMethod_fetchesCardById() throws StripeException {
            // Given
            Subscription fresh = subscription("sub_1", "cus_1", "active", "price_1", "Monthly", "month", 500L, "usd");
            PaymentMethod expanded = new PaymentMethod();
            expanded.setId("pm_expanded");
            fresh.setDefaultPaymentMethodObject(expanded);

            linkedCustomer("cus_1");
            when(stripeService.getSubscription("sub_1")).thenReturn(fresh);
            when(stripeService.getCardPaymentMethod("pm_expanded")).thenReturn(Optional.of(card("pm_expanded", "1881")));

            // When
            service.linkSubscription(memberId, fresh);

            // Then
            assertThat(capturedSnapshot().defaultPaymentCardLast4()).isEqualTo("1881");
        }

        @Test
        @DisplayName("should store no card when the default payment method is unset")
        void linkSubscription_unsetPaymentMethod_storesNoCard() throws StripeException {
            // Given
            Subscription fresh = subscription("sub_1", "cus_1", "active", "price_1", "Monthly", "month", 500L, "usd");
            linkedCustomer("cus_1");
            when(stripeService.getSubscription("sub_1")).thenReturn(fresh);

            // When
            service.linkSubscription(memberId, fresh);

            // Then
            assertThat(capturedSnapshot().defaultPaymentCardLast4()).isNull();
            verify(stripeService, never()).getCardPaymentMethod(anyString());
        }

        @Test
        @DisplayName("should store no card when the payment method is not a card")
        void linkSubscription_nonCardPaymentMethod_storesNoCard() throws StripeException {
            // Given
            Subscription fresh = subscription("sub_1", "cus_1", "active", "price_1", "Monthly", "month", 500L, "usd");
            fresh.setDefaultPaymentMethod("pm_sepa");
            linkedCustomer("cus_1");
            when(stripeService.getSubscription("sub_1")).thenReturn(fresh);
            when(stripeService.getCardPaymentMethod("pm_sepa")).thenReturn(Optional.empty());

            // When
            service.linkSubscription(memberId, fresh);

            // Then
            assertThat(capturedSnapshot().defaultPaymentCardLast4()).isNull();
        }

        @Test
        @DisplayName("should fall back to the plan interval when the plan has no nickname")
        void linkSubscription_planWithoutNickname_usesInterval() throws StripeException {
            // Given
            Subscription fresh = subscription("sub_1", "cus_1", "active", "price_1", null, "year", 5000L, "usd");
            fresh.setMetadata(Map.of("cancellation_reason", ""));
            linkedCustomer("cus_1");
            when(stripeService.getSubscription("sub_1")).thenReturn(fresh);

            // When
            service.linkSubscription(memberId, fresh);

            // Then
            SubscriptionSnapshot snapshot = capturedSnapshot();
            assertThat(snapshot.planNickname()).isEqualTo("year");
            assertThat(snapshot.cancellationReason()).isNull();
        }
    }

    @Nested
    @DisplayName("linkCustomer Tests")
    class LinkCustomerTests {

        @Test
        @DisplayName("should do nothing when Stripe has no such customer")
        void linkCustomer_missingCustomer_returnsEmpty() throws StripeException {
            when(stripeService.getCustomer("cus_missing")).thenReturn(Optional.empty());

            Optional<StripeCustomer> result = service.linkCustomer(memberId, "cus_missing");

            assertThat(result).isEmpty();
            verifyNoInteractions(mirrorStore);
        }

        @Test
        @DisplayName("should reject an unknown member before calling Stripe")
        void linkCustomer_unknownMember_throws() throws StripeException {
            UUID unknown = UUID.randomUUID();
            when(memberRepository.findById(unknown)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.linkCustomer(unknown, "cus_1"))
                    .isInstanceOf(MemberNotFoundException.class);

            verify(stripeService, never()).getCustomer(anyString());
        }

        @Test
        @DisplayName("should insert the customer then mirror each of its subscriptions in order")
        void linkCustomer_withSubscriptions_linksAllInOrder() throws StripeException {
            // Given
            Subscription first = subscription("sub_1", "cus_1", "active", "price_1", "Monthly", "month", 500L, "usd");
            Subscription second = subscription("sub_2", "cus_1", "canceled", "price_1", "Monthly", "month", 500L, "usd");
            Customer customer = customer("cus_1", first, second);
            customer.setName("Reader");
            customer.setEmail("reader@example.com");

            StripeCustomer row = customerRow("cus_1");
            when(stripeService.getCustomer("cus_1")).thenReturn(Optional.of(customer));
            when(mirrorStore.addCustomer(memberId, "cus_1", "Reader", "reader@example.com")).thenReturn(row);
            linkedCustomer("cus_1");
            when(stripeService.getSubscription("sub_1")).thenReturn(first);
            when(stripeService.getSubscription("sub_2")).thenReturn(second);

            // When
            Optional<StripeCustomer> result = service.linkCustomer(memberId, "cus_1");

            // Then
            assertThat(result).contains(row);
            InOrder inOrder = inOrder(mirrorStore, stripeService);
            inOrder.verify(mirrorStore).addCustomer(memberId, "cus_1", "Reader", "reader@example.com");
            inOrder.verify(stripeService).getSubscription("sub_1");
            inOrder.verify(mirrorStore).upsertSubscription(argThat(s -> s.subscriptionId().equals("sub_1")));
            inOrder.verify(stripeService).getSubscription("sub_2");
            inOrder.verify(mirrorStore).upsertSubscription(argThat(s -> s.subscriptionId().equals("sub_2")));
            verify(metricsService).recordOperation(MemberSubscriptionServiceImpl.LINK_CUSTOMER, true);
        }

        @Test
        @DisplayName("should keep earlier links when a later subscription fails")
        void linkCustomer_laterSubscriptionFails_propagatesAndKeepsEarlierLinks() throws StripeException {
            // Given
            Subscription first = subscription("sub_1", "cus_1", "active", "price_1", "Monthly", "month", 500L, "usd");
            Subscription second = subscription("sub_2", "cus_1", "active", "price_1", "Monthly", "month", 500L, "usd");
            when(stripeService.getCustomer("cus_1")).thenReturn(Optional.of(customer("cus_1", first, second)));
            when(mirrorStore.addCustomer(eq(memberId), eq("cus_1"), any(), any())).thenReturn(customerRow("cus_1"));
            linkedCustomer("cus_1");
            when(stripeService.getSubscription("sub_1")).thenReturn(first);
            when(stripeService.getSubscription("sub_2")).thenThrow(new ApiConnectionException("network down"));

            // When / Then
            assertThatThrownBy(() -> service.linkCustomer(memberId, "cus_1"))
                    .isInstanceOf(ApiConnectionException.class);

            verify(mirrorStore, times(1)).upsertSubscription(any());
            verify(mirrorStore, never()).deleteMemberRecords(any());
            verify(metricsService).recordOperation(MemberSubscriptionServiceImpl.LINK_CUSTOMER, false);
        }
    }

    @Nested
    @DisplayName("updateSubscriptionCancellation Tests")
    class UpdateSubscriptionCancellationTests {

        @Test
        @DisplayName("should reject a missing flag before any lookup or Stripe call")
        void updateSubscriptionCancellation_nullFlag_throwsIllegalArgument() throws StripeException {
            assertThatThrownBy(() -> service.updateSubscriptionCancellation(memberId, "sub_1", null))
                    .isInstanceOf(IllegalArgumentException.class);

            verifyNoInteractions(mirrorStore);
            verify(stripeService, never()).cancelSubscriptionAtPeriodEnd(anyString());
            verify(stripeService, never()).continueSubscriptionAtPeriodEnd(anyString());
        }

        @Test
        @DisplayName("should report a subscription the member does not have")
        void updateSubscriptionCancellation_unknownSubscription_throwsNotFound() throws StripeException {
            when(mirrorStore.findSubscription(memberId, "sub_x")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.updateSubscriptionCancellation(memberId, "sub_x", true))
                    .isInstanceOf(SubscriptionNotFoundException.class);

            verify(stripeService, never()).cancelSubscriptionAtPeriodEnd(anyString());
        }

        @Test
        @DisplayName("should cancel at period end in Stripe and then locally")
        void updateSubscriptionCancellation_true_cancelsAtPeriodEnd() throws StripeException {
            StripeCustomerSubscription row = subscriptionRow(7L, "sub_1", "cus_1", "active", "usd");
            StripeCustomerSubscription updated = subscriptionRow(7L, "sub_1", "cus_1", "active", "usd");
            updated.setCancelAtPeriodEnd(true);
            when(mirrorStore.findSubscription(memberId, "sub_1")).thenReturn(Optional.of(row));
            when(mirrorStore.updateCancelAtPeriodEnd(7L, true)).thenReturn(updated);

            StripeCustomerSubscription result = service.updateSubscriptionCancellation(memberId, "sub_1", true);

            assertThat(result.isCancelAtPeriodEnd()).isTrue();
            InOrder inOrder = inOrder(stripeService, mirrorStore);
            inOrder.verify(stripeService).cancelSubscriptionAtPeriodEnd("sub_1");
            inOrder.verify(mirrorStore).updateCancelAtPeriodEnd(7L, true);
            verify(stripeService, never()).continueSubscriptionAtPeriodEnd(anyString());
        }

        @Test
        @DisplayName("should continue at period end when the flag is false")
        void updateSubscriptionCancellation_false_continuesSubscription() throws StripeException {
            StripeCustomerSubscription row = subscriptionRow(7L, "sub_1", "cus_1", "active", "usd");
            when(mirrorStore.findSubscription(memberId, "sub_1")).thenReturn(Optional.of(row));
            when(mirrorStore.updateCancelAtPeriodEnd(7L, false)).thenReturn(row);

            service.updateSubscriptionCancellation(memberId, "sub_1", false);

            verify(stripeService).continueSubscriptionAtPeriodEnd("sub_1");
            verify(mirrorStore).updateCancelAtPeriodEnd(7L, false);
        }

        @Test
        @DisplayName("should leave the mirror untouched when Stripe fails")
        void updateSubscriptionCancellation_stripeFails_noLocalWrite() throws StripeException {
            StripeCustomerSubscription row = subscriptionRow(7L, "sub_1", "cus_1", "active", "usd");
            when(mirrorStore.findSubscription(memberId, "sub_1")).thenReturn(Optional.of(row));
            when(stripeService.cancelSubscriptionAtPeriodEnd("sub_1")).thenThrow(new ApiConnectionException("timeout"));

            assertThatThrownBy(() -> service.updateSubscriptionCancellation(memberId, "sub_1", true))
                    .isInstanceOf(ApiConnectionException.class);

            verify(mirrorStore, never()).updateCancelAtPeriodEnd(any(), anyBoolean());
        }
    }

    @Nested
    @DisplayName("grantComplimentary Tests")
    class GrantComplimentaryTests {

        @Test
        @DisplayName("should move an active usd subscription to the usd complimentary plan")
        void grantComplimentary_activeUsdSubscription_changesPlanInSameCurrency() throws StripeException {
            // Given
            StripeCustomerSubscription active = subscriptionRow(1L, "sub_1", "cus_1", "active", "usd");
            MembershipPlan usdComp = plan("price_comp_usd", "Complimentary", "month", "usd", true);
            Subscription changed = subscription("sub_1", "cus_1", "active", "price_comp_usd", "Complimentary", "month", 0L, "usd");

            when(mirrorStore.findSubscriptions(memberId)).thenReturn(List.of(active));
            when(stripePlansService.getComplimentaryPlan("usd")).thenReturn(Optional.of(usdComp));
            when(mirrorStore.findCustomers(memberId)).thenReturn(List.of(customerRow("cus_1")));
            when(stripeService.getCustomer("cus_1")).thenReturn(Optional.of(customer("cus_1")));
            when(stripeService.changeSubscriptionPlan("sub_1", "price_comp_usd")).thenReturn(changed);
            linkedCustomer("cus_1");
            when(stripeService.getSubscription("sub_1")).thenReturn(changed);

            // When
            ComplimentaryGrant grant = service.grantComplimentary(memberId);

            // Then
            assertThat(grant.currency()).isEqualTo("usd");
            assertThat(grant.planId()).isEqualTo("price_comp_usd");
            assertThat(grant.customerId()).isEqualTo("cus_1");
            assertThat(grant.customerCreated()).isFalse();
            assertThat(grant.subscriptionIds()).containsExactly("sub_1");
            verify(stripeService, never()).createSubscription(anyString(), anyString());
            verify(stripeService, never()).createCustomer(anyString());
            assertThat(capturedSnapshot().planId()).isEqualTo("price_comp_usd");
        }

        @Test
        @DisplayName("should keep the member's gbp currency when the stored currency is upper-case")
        void grantComplimentary_gbpSubscription_usesLowerCasedCurrency() throws StripeException {
            StripeCustomerSubscription active = subscriptionRow(1L, "sub_1", "cus_1", "past_due", "GBP");
            MembershipPlan gbpComp = plan("price_comp_gbp", "Complimentary", "month", "gbp", true);
            Subscription changed = subscription("sub_1", "cus_1", "active", "price_comp_gbp", "Complimentary", "month", 0L, "gbp");

            when(mirrorStore.findSubscriptions(memberId)).thenReturn(List.of(active));
            when(stripePlansService.getComplimentaryPlan("gbp")).thenReturn(Optional.of(gbpComp));
            when(mirrorStore.findCustomers(memberId)).thenReturn(List.of(customerRow("cus_1")));
            when(stripeService.getCustomer("cus_1")).thenReturn(Optional.of(customer("cus_1")));
            when(stripeService.changeSubscriptionPlan("sub_1", "price_comp_gbp")).thenReturn(changed);
            linkedCustomer("cus_1");
            when(stripeService.getSubscription("sub_1")).thenReturn(changed);

            ComplimentaryGrant grant = service.grantComplimentary(memberId);

            assertThat(grant.currency()).isEqualTo("gbp");
            verify(stripeService).changeSubscriptionPlan("sub_1", "price_comp_gbp");
            verify(stripePlansService, never()).getPlans();
        }

        @Test
        @DisplayName("should create a customer and subscription in the catalog currency for a member with nothing")
        void grantComplimentary_noCustomersNoSubscriptions_createsBoth() throws StripeException {
            // Given
            MembershipPlan yearlyUsd = plan("price_year_usd", "Yearly", "year", "usd", false);
            MembershipPlan monthlyEur = plan("price_month_eur", "Monthly", "month", "EUR", false);
            MembershipPlan eurComp = plan("price_comp_eur", "Complimentary", "month", "eur", true);
            Customer created = customer("cus_new");
            created.setEmail("reader@example.com");
            Subscription createdSubscription = subscription("sub_new", "cus_new", "active", "price_comp_eur", "Complimentary", "month", 0L, "eur");

            when(mirrorStore.findSubscriptions(memberId)).thenReturn(List.of());
            when(stripePlansService.getPlans()).thenReturn(List.of(yearlyUsd, monthlyEur));
            when(stripePlansService.getComplimentaryPlan("eur")).thenReturn(Optional.of(eurComp));
            when(mirrorStore.findCustomers(memberId)).thenReturn(List.of());
            when(stripeService.createCustomer("reader@example.com")).thenReturn(created);
            when(stripeService.createSubscription("cus_new", "price_comp_eur")).thenReturn(createdSubscription);
            linkedCustomer("cus_new");
            when(stripeService.getSubscription("sub_new")).thenReturn(createdSubscription);

            // When
            ComplimentaryGrant grant = service.grantComplimentary(memberId);

            // Then
            assertThat(grant.currency()).isEqualTo("eur");
            assertThat(grant.customerId()).isEqualTo("cus_new");
            assertThat(grant.customerCreated()).isTrue();
            assertThat(grant.subscriptionIds()).containsExactly("sub_new");
            assertThat(grant.customerProbes()).isEmpty();
            verify(stripeService, times(1)).createCustomer(anyString());
            verify(mirrorStore).upsertCustomer(memberId, "cus_new", null, "reader@example.com");
            verify(stripeService, times(1)).createSubscription(anyString(), anyString());
            verify(mirrorStore, times(1)).upsertSubscription(any());
            verify(stripeService, never()).changeSubscriptionPlan(anyString(), anyString());
        }

        @Test
        @DisplayName("should fail when the catalog has no monthly plan to take a currency from")
        void grantComplimentary_noMonthlyPlan_throwsPlanNotFound() throws StripeException {
            when(mirrorStore.findSubscriptions(memberId)).thenReturn(List.of());
            when(stripePlansService.getPlans()).thenReturn(List.of(plan("price_year", "Yearly", "year", "usd", false)));

            assertThatThrownBy(() -> service.grantComplimentary(memberId))
                    .isInstanceOf(ComplimentaryPlanNotFoundException.class)
                    .hasMessageContaining("interval 'month'");

            verify(stripeService, never()).createCustomer(anyString());
            verify(stripeService, never()).createSubscription(anyString(), anyString());
        }

        @Test
        @DisplayName("should name the configured default interval when no plan carries it")
        void grantComplimentary_noPlanForConfiguredInterval_namesInterval() {
            billingProperties.setDefaultCurrencyInterval("year");
            when(mirrorStore.findSubscriptions(memberId)).thenReturn(List.of());
            when(stripePlansService.getPlans()).thenReturn(List.of(plan("price_month", "Monthly", "month", "usd", false)));

            assertThatThrownBy(() -> service.grantComplimentary(memberId))
                    .hasMessageContaining("interval 'year'")
                    .isInstanceOfSatisfying(ComplimentaryPlanNotFoundException.class,
                            e -> assertThat(e.getCurrency()).isNull());
        }

        @Test
        @DisplayName("should fail without Stripe writes when no complimentary plan exists for the currency")
        void grantComplimentary_noPlanForCurrency_throwsPlanNotFound() throws StripeException {
            StripeCustomerSubscription active = subscriptionRow(1L, "sub_1", "cus_1", "trialing", "chf");
            when(mirrorStore.findSubscriptions(memberId)).thenReturn(List.of(active));
            when(stripePlansService.getComplimentaryPlan("chf")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.grantComplimentary(memberId))
                    .isInstanceOf(ComplimentaryPlanNotFoundException.class)
                    .hasMessageContaining("chf");

            verify(stripeService, never()).getCustomer(anyString());
            verify(stripeService, never()).changeSubscriptionPlan(anyString(), anyString());
            verify(metricsService).recordOperation(MemberSubscriptionServiceImpl.GRANT_COMPLIMENTARY, false);
        }

        @Test
        @DisplayName("should skip customers that fail to load or are deleted and adopt the next usable one")
        void grantComplimentary_probeFailures_adoptsFirstUsableCustomer() throws StripeException {
            // Given
            MembershipPlan eurComp = plan("price_comp_eur", "Complimentary", "month", "eur", true);
            Customer deleted = customer("cus_deleted");
            deleted.setDeleted(true);
            Subscription createdSubscription = subscription("sub_new", "cus_ok", "active", "price_comp_eur", "Complimentary", "month", 0L, "eur");

            when(mirrorStore.findSubscriptions(memberId)).thenReturn(List.of());
            when(stripePlansService.getPlans()).thenReturn(List.of(plan("price_m", "Monthly", "month", "eur", false)));
            when(stripePlansService.getComplimentaryPlan("eur")).thenReturn(Optional.of(eurComp));
            when(mirrorStore.findCustomers(memberId)).thenReturn(List.of(
                    customerRow("cus_broken"), customerRow("cus_gone"), customerRow("cus_deleted"), customerRow("cus_ok")));
            when(stripeService.getCustomer("cus_broken")).thenThrow(new ApiConnectionException("boom"));
            when(stripeService.getCustomer("cus_gone")).thenReturn(Optional.empty());
            when(stripeService.getCustomer("cus_deleted")).thenReturn(Optional.of(deleted));
            when(stripeService.getCustomer("cus_ok")).thenReturn(Optional.of(customer("cus_ok")));
            when(stripeService.createSubscription("cus_ok", "price_comp_eur")).thenReturn(createdSubscription);
            linkedCustomer("cus_ok");
            when(stripeService.getSubscription("sub_new")).thenReturn(createdSubscription);

            // When
            ComplimentaryGrant grant = service.grantComplimentary(memberId);

            // Then
            assertThat(grant.customerId()).isEqualTo("cus_ok");
            assertThat(grant.customerCreated()).isFalse();
            assertThat(grant.customerProbes())
                    .extracting(ReconciliationOutcome::itemId, ReconciliationOutcome::succeeded)
                    .containsExactly(
                            tuple("cus_broken", false),
                            tuple("cus_gone", false),
                            tuple("cus_deleted", false),
                            tuple("cus_ok", true));
            assertThat(grant.customerProbes().get(0).error()).isInstanceOf(ApiConnectionException.class);
            verify(stripeService, never()).createCustomer(anyString());
            verify(metricsService).recordBestEffortFailure(MemberSubscriptionServiceImpl.PROBE_CUSTOMER);
        }

        @Test
        @DisplayName("should attempt every active subscription and rethrow the first failure")
        void grantComplimentary_oneChangeFails_attemptsAllThenThrows() throws StripeException {
            // Given
            StripeCustomerSubscription first = subscriptionRow(1L, "sub_1", "cus_1", "active", "usd");
            StripeCustomerSubscription second = subscriptionRow(2L, "sub_2", "cus_1", "unpaid", "usd");
            StripeCustomerSubscription canceled = subscriptionRow(3L, "sub_3", "cus_1", "canceled", "usd");
            MembershipPlan usdComp = plan("price_comp_usd", "Complimentary", "month", "usd", true);
            Subscription changedSecond = subscription("sub_2", "cus_1", "active", "price_comp_usd", "Complimentary", "month", 0L, "usd");
            ApiConnectionException failure = new ApiConnectionException("first change failed");

            when(mirrorStore.findSubscriptions(memberId)).thenReturn(List.of(first, second, canceled));
            when(stripePlansService.getComplimentaryPlan("usd")).thenReturn(Optional.of(usdComp));
            when(mirrorStore.findCustomers(memberId)).thenReturn(List.of(customerRow("cus_1")));
            when(stripeService.getCustomer("cus_1")).thenReturn(Optional.of(customer("cus_1")));
            when(stripeService.changeSubscriptionPlan("sub_1", "price_comp_usd")).thenThrow(failure);
            when(stripeService.changeSubscriptionPlan("sub_2", "price_comp_usd")).thenReturn(changedSecond);
            linkedCustomer("cus_1");
            when(stripeService.getSubscription("sub_2")).thenReturn(changedSecond);

            // When / Then
            assertThatThrownBy(() -> service.grantComplimentary(memberId)).isSameAs(failure);

            verify(stripeService).changeSubscriptionPlan("sub_2", "price_comp_usd");
            verify(stripeService, never()).changeSubscriptionPlan(eq("sub_3"), anyString());
            verify(mirrorStore, times(1)).upsertSubscription(argThat(s -> s.subscriptionId().equals("sub_2")));
        }
    }

    @Nested
    @DisplayName("cancelComplimentary Tests")
    class CancelComplimentaryTests {

        @Test
        @DisplayName("should cancel every live subscription and report a failure without throwing")
        void cancelComplimentary_secondCancelFails_returnsOutcomes() throws StripeException {
            // Given
            StripeCustomerSubscription alreadyCanceled = subscriptionRow(1L, "sub_0", "cus_1", "canceled", "usd");
            StripeCustomerSubscription first = subscriptionRow(2L, "sub_1", "cus_1", "active", "usd");
            StripeCustomerSubscription second = subscriptionRow(3L, "sub_2", "cus_1", "trialing", "usd");
            Subscription cancelledFirst = subscription("sub_1", "cus_1", "canceled", "price_comp_usd", "Complimentary", "month", 0L, "usd");

            when(mirrorStore.findSubscriptions(memberId)).thenReturn(List.of(alreadyCanceled, first, second));
            when(stripeService.cancelSubscription("sub_1")).thenReturn(cancelledFirst);
            when(stripeService.cancelSubscription("sub_2")).thenThrow(new ApiConnectionException("gateway unavailable"));
            linkedCustomer("cus_1");
            when(stripeService.getSubscription("sub_1")).thenReturn(cancelledFirst);

            // When
            List<ReconciliationOutcome> outcomes = service.cancelComplimentary(memberId);

            // Then
            assertThat(outcomes).hasSize(2);
            assertThat(outcomes.get(0).itemId()).isEqualTo("sub_1");
            assertThat(outcomes.get(0).succeeded()).isTrue();
            assertThat(outcomes.get(1).itemId()).isEqualTo("sub_2");
            assertThat(outcomes.get(1).succeeded()).isFalse();
            assertThat(outcomes.get(1).error()).isInstanceOf(ApiConnectionException.class);

            verify(stripeService, never()).cancelSubscription("sub_0");
            verify(mirrorStore, times(1)).upsertSubscription(argThat(s -> s.subscriptionId().equals("sub_1")));
            verify(metricsService).recordBestEffortFailure(MemberSubscriptionServiceImpl.CANCEL_COMPLIMENTARY);
            verify(metricsService).recordOperation(MemberSubscriptionServiceImpl.CANCEL_COMPLIMENTARY, true);
        }

        @Test
        @DisplayName("should return no outcomes for a member without subscriptions")
        void cancelComplimentary_noSubscriptions_returnsEmpty() {
            when(mirrorStore.findSubscriptions(memberId)).thenReturn(List.of());

            assertThat(service.cancelComplimentary(memberId)).isEmpty();

            verifyNoMoreInteractions(ignoreStubs(stripeService));
        }
    }

    private void linkedCustomer(String customerId) {
        lenient().when(mirrorStore.findCustomer(memberId, customerId)).thenReturn(Optional.of(customerRow(customerId)));
    }

    private SubscriptionSnapshot capturedSnapshot() {
        ArgumentCaptor<SubscriptionSnapshot> captor = ArgumentCaptor.forClass(SubscriptionSnapshot.class);
        verify(mirrorStore, atLeastOnce()).upsertSubscription(captor.capture());
        return captor.getValue();
    }

    private StripeCustomer customerRow(String customerId) {
        StripeCustomer customer = new StripeCustomer();
        customer.setCustomerId(customerId);
        customer.setMemberId(memberId);
        return customer;
    }

    private static StripeCustomerSubscription subscriptionRow(Long id, String subscriptionId, String customerId,
                                                              String status, String currency) {
        StripeCustomerSubscription row = new StripeCustomerSubscription();
        row.setId(id);
        row.setSubscriptionId(subscriptionId);
        row.setCustomerId(customerId);
        row.setStatus(status);
        row.setPlanId("price_1");
        row.setPlanNickname("Monthly");
        row.setPlanInterval("month");
        row.setPlanAmount(500L);
        row.setPlanCurrency(currency);
        return row;
    }

    private static StripeCustomerSubscription mirrored(SubscriptionSnapshot snapshot) {
        StripeCustomerSubscription row = subscriptionRow(1L, snapshot.subscriptionId(), snapshot.customerId(),
                snapshot.status(), snapshot.planCurrency());
        row.setCancelAtPeriodEnd(snapshot.cancelAtPeriodEnd());
        row.setPlanId(snapshot.planId());
        return row;
    }

    private static MembershipPlan plan(String priceId, String nickname, String interval, String currency, boolean complimentary) {
        MembershipPlan plan = new MembershipPlan();
        plan.setId(UUID.randomUUID());
        plan.setStripePriceId(priceId);
        plan.setNickname(nickname);
        plan.setInterval(interval);
        plan.setCurrency(currency);
        plan.setComplimentary(complimentary);
        return plan;
    }

    private static Customer customer(String id, Subscription... subscriptions) {
        Customer customer = new Customer();
        customer.setId(id);
        SubscriptionCollection collection = new SubscriptionCollection();
        collection.setData(List.of(subscriptions));
        customer.setSubscriptions(collection);
        return customer;
    }

    private static PaymentMethod card(String id, String last4) {
        PaymentMethod.Card card = new PaymentMethod.Card();
        card.setLast4(last4);
        PaymentMethod paymentMethod = new PaymentMethod();
        paymentMethod.setId(id);
        paymentMethod.setType("card");
        paymentMethod.setCard(card);
        return paymentMethod;
    }

    private static Subscription subscription(String id, String customerId, String status, String priceId,
                                             String nickname, String interval, long amount, String currency) {
        Price.Recurring recurring = new Price.Recurring();
        recurring.setInterval(interval);

        Price price = new Price();
        price.setId(priceId);
        price.setNickname(nickname);
        price.setRecurring(recurring);
        price.setUnitAmount(amount);
        price.setCurrency(currency);

        SubscriptionItem item = new SubscriptionItem();
        item.setId("si_" + id);
        item.setPrice(price);

        SubscriptionItemCollection items = new SubscriptionItemCollection();
        items.setData(List.of(item));

        Subscription subscription = new Subscription();
        subscription.setId(id);
        subscription.setCustomer(customerId);
        subscription.setStatus(status);
        subscription.setCancelAtPeriodEnd(false);
        subscription.setCurrentPeriodEnd(PERIOD_END);
        subscription.setStartDate(START_DATE);
        subscription.setItems(items);
        subscription.setMetadata(new HashMap<>());
        return subscription;
    }
}
