package uk.gegc.members.features.billing.api.dto;

import uk.gegc.members.features.billing.domain.model.ComplimentaryGrant;

import java.util.List;

public record ComplimentaryGrantDto(
        String currency,
        String planId,
        String customerId,
        boolean customerCreated,
        List<String> subscriptionIds,
        List<OutcomeDto> customerProbes
) {

    public static ComplimentaryGrantDto from(ComplimentaryGrant grant) {
        return new ComplimentaryGrantDto(
                grant.currency(),
                grant.planId(),
                grant.customerId(),
                grant.customerCreated(),
                grant.subscriptionIds(),
                grant.customerProbes().stream().map(OutcomeDto::from).toList()
        );
    }
}
