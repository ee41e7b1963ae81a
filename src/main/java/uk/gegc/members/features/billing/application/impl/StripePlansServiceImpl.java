package uk.gegc.members.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.members.features.billing.application.StripePlansService;
import uk.gegc.members.features.billing.domain.model.MembershipPlan;
import uk.gegc.members.features.billing.infra.repository.MembershipPlanRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class StripePlansServiceImpl implements StripePlansService {

    private static final Comparator<MembershipPlan> CATALOG_ORDER =
            Comparator.comparingLong(MembershipPlan::getAmount).thenComparing(MembershipPlan::getStripePriceId);

    private final MembershipPlanRepository membershipPlanRepository;

    @Override
    @Transactional(readOnly = true)
    public List<MembershipPlan> getPlans() {
        return membershipPlanRepository.findByActiveTrue().stream()
                .sorted(CATALOG_ORDER)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<MembershipPlan> getComplimentaryPlan(String currency) {
        if (currency == null || currency.isBlank()) {
            return Optional.empty();
        }
        return membershipPlanRepository
                .findByActiveTrueAndComplimentaryTrueAndCurrency(currency.trim().toLowerCase(Locale.ROOT))
                .stream()
                .min(CATALOG_ORDER);
    }
}
