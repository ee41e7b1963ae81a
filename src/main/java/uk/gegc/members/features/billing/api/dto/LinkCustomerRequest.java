package uk.gegc.members.features.billing.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record LinkCustomerRequest(
        @JsonProperty("customerId")
        @NotBlank(message = "Customer ID is required")
        String customerId
) {}
