package uk.gegc.members.features.billing.application.impl;

import com.stripe.StripeClient;
import com.stripe.exception.StripeException;
import com.stripe.model.Price;
import com.stripe.model.StripeCollection;
import com.stripe.param.PriceListParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import uk.gegc.members.features.billing.application.BillingProperties;
import uk.gegc.members.features.billing.application.StripePlanSyncService;
import uk.gegc.members.features.billing.application.StripeProperties;
import uk.gegc.members.features.billing.domain.model.MembershipPlan;
import uk.gegc.members.features.billing.infra.repository.MembershipPlanRepository;

import java.util.*;

/**
 * Default implementation of {@link StripePlanSyncService}.
 * <p>
 * A price is complimentary when its nickname matches the configured complimentary nickname
 * or its metadata has {@code complimentary=true}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StripePlanSyncServiceImpl implements StripePlanSyncService {

    static final String COMPLIMENTARY_METADATA_KEY = "complimentary";
    private static final long PAGE_SIZE = 100L;

    private final MembershipPlanRepository membershipPlanRepository;
    private final StripeProperties stripeProperties;
    private final BillingProperties billingProperties;

    @Autowired(required = false)
    private StripeClient stripeClient;

    @Override
    @Transactional
    public void syncActivePlans() {
        if (!StringUtils.hasText(stripeProperties.getSecretKey()) || stripeClient == null) {
            log.debug("StripePlanSyncService: secret key not configured; skipping plan sync");
            return;
        }

        try {
            log.info("StripePlanSyncService: starting sync of MembershipPlans from Stripe Prices");

            List<MembershipPlan> existingPlans = membershipPlanRepository.findAll();
            Map<String, MembershipPlan> plansByPriceId = new HashMap<>();
            for (MembershipPlan plan : existingPlans) {
                plansByPriceId.put(plan.getStripePriceId(), plan);
            }

            List<Price> stripePrices = fetchActiveRecurringPrices();
            if (stripePrices.isEmpty()) {
                log.warn("StripePlanSyncService: no active recurring prices found in Stripe; leaving existing plans unchanged");
                return;
            }

            Set<String> seenPriceIds = new HashSet<>();
            for (Price price : stripePrices) {
                String priceId = price.getId();
                String currency = price.getCurrency();
                if (!StringUtils.hasText(priceId) || !StringUtils.hasText(currency)) {
                    continue;
                }

                seenPriceIds.add(priceId);

                MembershipPlan plan = plansByPriceId.get(priceId);
                boolean isNew = false;
                if (plan == null) {
                    plan = new MembershipPlan();
                    isNew = true;
                }

                plan.setStripePriceId(priceId);
                plan.setNickname(price.getNickname());
                plan.setInterval(price.getRecurring().getInterval());
                plan.setAmount(price.getUnitAmount() != null ? price.getUnitAmount() : 0L);
                plan.setCurrency(currency.toLowerCase(Locale.ROOT));
                plan.setComplimentary(isComplimentary(price));
                plan.setActive(true);

                membershipPlanRepository.save(plan);

                log.info("StripePlanSyncService: {} MembershipPlan '{}' (priceId={}, interval={}, amount={}, currency={}, complimentary={})",
                        isNew ? "created" : "updated", plan.getNickname(), priceId, plan.getInterval(),
                        plan.getAmount(), plan.getCurrency(), plan.isComplimentary());
            }

            for (MembershipPlan existing : existingPlans) {
                if (!seenPriceIds.contains(existing.getStripePriceId()) && existing.isActive()) {
                    existing.setActive(false);
                    membershipPlanRepository.save(existing);
                    log.info("StripePlanSyncService: deactivated MembershipPlan '{}' (priceId={})",
                            existing.getNickname(), existing.getStripePriceId());
                }
            }

            log.info("StripePlanSyncService: completed sync of MembershipPlans from Stripe");
        } catch (StripeException e) {
            log.warn("StripePlanSyncService: failed to sync MembershipPlans from Stripe: {}", e.getMessage(), e);
        }
    }

    private List<Price> fetchActiveRecurringPrices() throws StripeException {
        List<Price> result = new ArrayList<>();
        String startingAfter = null;
        boolean hasMore = true;
        while (hasMore) {
            PriceListParams.Builder params = PriceListParams.builder()
                    .setActive(true)
                    .setType(PriceListParams.Type.RECURRING)
                    .setLimit(PAGE_SIZE);
            if (startingAfter != null) {
                params.setStartingAfter(startingAfter);
            }

            StripeCollection<Price> page = stripeClient.prices().list(params.build());
            List<Price> prices = page.getData() != null ? page.getData() : Collections.emptyList();
            for (Price price : prices) {
                if (price.getRecurring() != null && StringUtils.hasText(price.getRecurring().getInterval())) {
                    result.add(price);
                }
            }

            hasMore = Boolean.TRUE.equals(page.getHasMore()) && !prices.isEmpty();
            if (hasMore) {
                startingAfter = prices.get(prices.size() - 1).getId();
            }
        }
        return result;
    }

    private boolean isComplimentary(Price price) {
        if (price.getNickname() != null
                && price.getNickname().trim().equalsIgnoreCase(billingProperties.getComplimentaryNickname())) {
            return true;
        }
        Map<String, String> metadata = price.getMetadata();
        return metadata != null && "true".equalsIgnoreCase(metadata.get(COMPLIMENTARY_METADATA_KEY));
    }
}
