package uk.gegc.members.features.billing.api.dto;

import uk.gegc.members.features.billing.domain.model.StripeCustomer;

import java.time.LocalDateTime;
import java.util.UUID;

public record StripeCustomerDto(
        String customerId,
        UUID memberId,
        String name,
        String email,
        LocalDateTime createdAt
) {

    public static StripeCustomerDto from(StripeCustomer customer) {
        return new StripeCustomerDto(
                customer.getCustomerId(),
                customer.getMemberId(),
                customer.getName(),
                customer.getEmail(),
                customer.getCreatedAt()
        );
    }
}
