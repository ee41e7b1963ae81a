package uk.gegc.members.features.member.api.dto;

import uk.gegc.members.features.member.domain.model.Member;

import java.time.LocalDateTime;
import java.util.UUID;

public record MemberDto(
        UUID id,
        String email,
        String name,
        String note,
        boolean subscribed,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {

    public static MemberDto from(Member member) {
        return new MemberDto(
                member.getId(),
                member.getEmail(),
                member.getName(),
                member.getNote(),
                member.isSubscribed(),
                member.getCreatedAt(),
                member.getUpdatedAt()
        );
    }
}
