package uk.gegc.members.features.member.application;

import com.stripe.exception.StripeException;
import uk.gegc.members.features.member.api.dto.CreateMemberRequest;
import uk.gegc.members.features.member.api.dto.UpdateMemberRequest;
import uk.gegc.members.features.member.domain.model.Member;

import java.util.UUID;

public interface MemberService {

    Member get(UUID memberId);

    /**
     * Member owning the linked Stripe customer.
     */
    Member getByCustomerId(String customerId);

    Member create(CreateMemberRequest request);

    /**
     * Apply a partial update. When the email changes and Stripe is configured, the new email is pushed
     * to every Stripe customer linked to the member.
     */
    Member update(UUID memberId, UpdateMemberRequest request) throws StripeException;

    /**
     * Delete a member with its Stripe mirror rows. Deleting a missing member does nothing.
     *
     * @param cancelStripeSubscriptions cancel every subscription that is not already canceled at Stripe
     *                                  first; a Stripe failure aborts the deletion
     */
    void destroy(UUID memberId, boolean cancelStripeSubscriptions) throws StripeException;
}
