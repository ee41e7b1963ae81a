package uk.gegc.members.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Local mirror of a Stripe subscription. {@code subscriptionId} is the upsert key.
 */
@Entity
@Table(name = "members_stripe_customer_subscriptions")
@Getter
@Setter
public class StripeCustomerSubscription {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "customer_id", nullable = false, length = 255)
    private String customerId;

    @Column(name = "subscription_id", nullable = false, unique = true, length = 255)
    private String subscriptionId;

    @Column(name = "status", nullable = false, length = 50)
    private String status;

    @Column(name = "cancel_at_period_end", nullable = false)
    private boolean cancelAtPeriodEnd;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Column(name = "current_period_end", nullable = false)
    private Instant currentPeriodEnd;

    @Column(name = "start_date", nullable = false)
    private Instant startDate;

    @Column(name = "default_payment_card_last4", length = 4)
    private String defaultPaymentCardLast4;

    @Column(name = "plan_id", nullable = false, length = 255)
    private String planId;

    @Column(name = "plan_nickname", nullable = false, length = 255)
    private String planNickname;

    @Column(name = "plan_interval", nullable = false, length = 50)
    private String planInterval;

    @Column(name = "plan_amount", nullable = false)
    private long planAmount;

    @Column(name = "plan_currency", nullable = false, length = 3)
    private String planCurrency;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt = LocalDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt = LocalDateTime.now();

    @PreUpdate
    public void preUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    public boolean isActiveLike() {
        return StripeSubscriptionStatuses.isActiveLike(status);
    }

    public boolean isCanceled() {
        return StripeSubscriptionStatuses.CANCELED.equals(status);
    }
}
