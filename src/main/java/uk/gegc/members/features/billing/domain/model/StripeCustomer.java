package uk.gegc.members.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Local mirror of a Stripe customer linked to a member.
 */
@Entity
@Table(name = "members_stripe_customers")
@Getter
@Setter
public class StripeCustomer {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "customer_id", nullable = false, unique = true, length = 255)
    private String customerId;

    @Column(name = "member_id", nullable = false)
    private UUID memberId;

    @Column(name = "name", length = 191)
    private String name;

    @Column(name = "email", length = 191)
    private String email;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt = LocalDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt = LocalDateTime.now();

    @PreUpdate
    public void preUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
