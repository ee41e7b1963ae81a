package uk.gegc.members.features.member.domain.exception;

import java.util.UUID;

public class MemberNotFoundException extends RuntimeException {

    private final UUID memberId;

    public MemberNotFoundException(UUID memberId) {
        this(memberId, "Member " + memberId + " not found");
    }

    private MemberNotFoundException(UUID memberId, String message) {
        super(message);
        this.memberId = memberId;
    }

    public static MemberNotFoundException forCustomer(String customerId) {
        return new MemberNotFoundException(null, "No member is linked to Stripe customer " + customerId);
    }

    /**
     * @return the missing member id, or {@code null} when the lookup was by Stripe customer
     */
    public UUID getMemberId() {
        return memberId;
    }
}
