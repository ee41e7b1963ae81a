package uk.gegc.members.features.billing.api.dto;

import java.util.UUID;

public record PlanDto(
        UUID id,
        String stripePriceId,
        String nickname,
        String interval,
        long amount,
        String currency,
        boolean complimentary
) {}
