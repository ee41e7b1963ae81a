package uk.gegc.members.features.member.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

/**
 * Partial update; {@code null} fields are left unchanged.
 */
public record UpdateMemberRequest(
        @JsonProperty("email")
        @Email(message = "Email must be valid")
        @Size(max = 191, message = "Email must not exceed 191 characters")
        String email,

        @JsonProperty("name")
        @Size(max = 191, message = "Name must not exceed 191 characters")
        String name,

        @JsonProperty("note")
        @Size(max = 2000, message = "Note must not exceed 2000 characters")
        String note,

        @JsonProperty("subscribed")
        Boolean subscribed
) {}
