package uk.gegc.members.features.billing.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UpdateSubscriptionCancellationRequest(
        @JsonProperty("cancelAtPeriodEnd")
        Boolean cancelAtPeriodEnd
) {}
