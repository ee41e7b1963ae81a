package uk.gegc.members.features.billing.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.members.features.billing.domain.model.MembershipPlan;
import uk.gegc.members.features.billing.infra.repository.MembershipPlanRepository;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StripePlansServiceImplTest {

    @Mock
    private MembershipPlanRepository membershipPlanRepository;

    private StripePlansServiceImpl plansService;

    @BeforeEach
    void setUp() {
        plansService = new StripePlansServiceImpl(membershipPlanRepository);
    }

    @Test
    @DisplayName("getPlans: returns active plans cheapest first")
    void getPlans_sortsByAmount() {
        MembershipPlan yearly = plan("price_year", 5000L, "usd");
        MembershipPlan monthly = plan("price_month", 500L, "usd");
        when(membershipPlanRepository.findByActiveTrue()).thenReturn(List.of(yearly, monthly));

        assertThat(plansService.getPlans()).containsExactly(monthly, yearly);
    }

    @Test
    @DisplayName("getComplimentaryPlan: matches the currency case-insensitively")
    void getComplimentaryPlan_upperCaseCurrency_normalizes() {
        MembershipPlan comp = plan("price_comp_eur", 0L, "eur");
        when(membershipPlanRepository.findByActiveTrueAndComplimentaryTrueAndCurrency("eur")).thenReturn(List.of(comp));

        assertThat(plansService.getComplimentaryPlan(" EUR ")).contains(comp);
    }

    @Test
    @DisplayName("getComplimentaryPlan: blank currency has no plan")
    void getComplimentaryPlan_blank_returnsEmpty() {
        assertThat(plansService.getComplimentaryPlan("")).isEmpty();
        assertThat(plansService.getComplimentaryPlan(null)).isEmpty();
        verifyNoInteractions(membershipPlanRepository);
    }

    private static MembershipPlan plan(String priceId, long amount, String currency) {
        MembershipPlan plan = new MembershipPlan();
        plan.setStripePriceId(priceId);
        plan.setAmount(amount);
        plan.setCurrency(currency);
        plan.setInterval("month");
        plan.setComplimentary(amount == 0L);
        return plan;
    }
}
