package uk.gegc.members.features.billing.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.members.features.billing.application.StripePlanSyncService;
import uk.gegc.members.shared.config.FeatureFlags;

/**
 * Scheduled job that periodically synchronizes MembershipPlan records with Stripe.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "members.billing.plan-sync.enabled", havingValue = "true", matchIfMissing = true)
public class StripePlanSyncScheduler {

    private final StripePlanSyncService stripePlanSyncService;
    private final FeatureFlags featureFlags;

    @Scheduled(fixedDelayString = "${members.billing.plan-sync.fixed-delay-ms:3600000}")
    public void syncPlans() {
        if (!featureFlags.isBilling()) {
            return;
        }
        try {
            stripePlanSyncService.syncActivePlans();
        } catch (RuntimeException e) {
            log.warn("StripePlanSyncScheduler: error during plan sync", e);
        }
    }
}
