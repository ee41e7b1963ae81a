package uk.gegc.members.features.member.application.impl;

import com.stripe.exception.StripeException;
import com.stripe.model.Subscription;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.members.features.billing.application.MemberSubscriptionService;
import uk.gegc.members.features.billing.application.StripeMirrorStore;
import uk.gegc.members.features.billing.application.StripeService;
import uk.gegc.members.features.billing.domain.model.StripeCustomer;
import uk.gegc.members.features.billing.domain.model.StripeCustomerSubscription;
import uk.gegc.members.features.member.api.dto.CreateMemberRequest;
import uk.gegc.members.features.member.api.dto.UpdateMemberRequest;
import uk.gegc.members.features.member.application.MemberService;
import uk.gegc.members.features.member.domain.exception.MemberAlreadyExistsException;
import uk.gegc.members.features.member.domain.exception.MemberNotFoundException;
import uk.gegc.members.features.member.domain.model.Member;
import uk.gegc.members.features.member.domain.model.MemberSnapshot;
import uk.gegc.members.features.member.domain.repository.MemberRepository;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class MemberServiceImpl implements MemberService {

    private final MemberRepository memberRepository;
    private final StripeService stripeService;
    private final StripeMirrorStore mirrorStore;
    private final MemberSubscriptionService memberSubscriptionService;

    @Override
    @Transactional(readOnly = true)
    public Member get(UUID memberId) {
        return memberRepository.findById(memberId)
                .orElseThrow(() -> new MemberNotFoundException(memberId));
    }

    @Override
    @Transactional(readOnly = true)
    public Member getByCustomerId(String customerId) {
        return memberRepository.findByStripeCustomerId(customerId)
                .orElseThrow(() -> MemberNotFoundException.forCustomer(customerId));
    }

    @Override
    @Transactional
    public Member create(CreateMemberRequest request) {
        String email = normalizeEmail(request.email());
        if (memberRepository.existsByEmail(email)) {
            throw new MemberAlreadyExistsException(email);
        }

        Member member = new Member();
        member.setEmail(email);
        member.setName(request.name());
        member.setNote(request.note());
        member.setSubscribed(request.subscribed() == null || request.subscribed());

        Member saved = memberRepository.save(member);
        log.info("Created member {} ({})", saved.getId(), email);
        return saved;
    }

    @Override
    public Member update(UUID memberId, UpdateMemberRequest request) throws StripeException {
        Member member = get(memberId);
        MemberSnapshot before = MemberSnapshot.of(member);

        if (request.email() != null) {
            String email = normalizeEmail(request.email());
            if (!email.equals(member.getEmail()) && memberRepository.existsByEmail(email)) {
                throw new MemberAlreadyExistsException(email);
            }
            member.setEmail(email);
        }
        if (request.name() != null) {
            member.setName(request.name());
        }
        if (request.note() != null) {
            member.setNote(request.note());
        }
        if (request.subscribed() != null) {
            member.setSubscribed(request.subscribed());
        }

        Set<MemberSnapshot.Field> changed = before.changedFields(MemberSnapshot.of(member));
        if (changed.isEmpty()) {
            return member;
        }

        Member saved = memberRepository.save(member);
        log.info("Updated member {} fields {}", memberId, changed);

        if (changed.contains(MemberSnapshot.Field.EMAIL)) {
            propagateEmail(saved);
        }
        return saved;
    }

    @Override
    public void destroy(UUID memberId, boolean cancelStripeSubscriptions) throws StripeException {
        Optional<Member> existing = memberRepository.findById(memberId);
        if (existing.isEmpty()) {
            log.info("Member {} does not exist; nothing to delete", memberId);
            return;
        }

        if (cancelStripeSubscriptions) {
            if (stripeService.isConfigured()) {
                cancelSubscriptions(memberId);
            } else {
                log.warn("Stripe is not configured; keeping Stripe subscriptions of member {}", memberId);
            }
        }

        mirrorStore.deleteMemberRecords(memberId);
        memberRepository.delete(existing.get());
        log.info("Deleted member {}", memberId);
    }

    private void cancelSubscriptions(UUID memberId) throws StripeException {
        for (StripeCustomerSubscription subscription : mirrorStore.findSubscriptions(memberId)) {
            if (subscription.isCanceled()) {
                continue;
            }
            Subscription cancelled = stripeService.cancelSubscription(subscription.getSubscriptionId());
            memberSubscriptionService.linkSubscription(memberId, cancelled);
        }
    }

    private void propagateEmail(Member member) throws StripeException {
        if (!stripeService.isConfigured()) {
            log.warn("Stripe is not configured; email change of member {} not sent to Stripe", member.getId());
            return;
        }
        for (StripeCustomer customer : mirrorStore.findCustomers(member.getId())) {
            stripeService.updateCustomerEmail(customer.getCustomerId(), member.getEmail());
            mirrorStore.updateCustomerEmail(customer.getCustomerId(), member.getEmail());
        }
    }

    private static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
