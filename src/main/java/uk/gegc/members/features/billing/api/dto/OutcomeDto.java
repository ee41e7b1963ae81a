package uk.gegc.members.features.billing.api.dto;

import uk.gegc.members.features.billing.domain.model.ReconciliationOutcome;

public record OutcomeDto(
        String id,
        boolean succeeded,
        String detail
) {

    public static OutcomeDto from(ReconciliationOutcome outcome) {
        return new OutcomeDto(outcome.itemId(), outcome.succeeded(), outcome.detail());
    }
}
