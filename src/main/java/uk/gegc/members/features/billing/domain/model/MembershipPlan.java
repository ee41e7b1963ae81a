package uk.gegc.members.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

/**
 * Recurring Stripe price offered to members, synced from Stripe.
 */
@Entity
@Table(name = "membership_plans")
@Getter
@Setter
public class MembershipPlan {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "stripe_price_id", nullable = false, unique = true, length = 100)
    private String stripePriceId;

    @Column(name = "nickname", length = 255)
    private String nickname;

    @Column(name = "billing_interval", nullable = false, length = 20)
    private String interval;

    @Column(name = "amount", nullable = false)
    private long amount;

    @Column(name = "currency", nullable = false, length = 10)
    private String currency;

    @Column(name = "complimentary", nullable = false)
    private boolean complimentary;

    @Column(name = "active", nullable = false)
    private boolean active = true;
}
