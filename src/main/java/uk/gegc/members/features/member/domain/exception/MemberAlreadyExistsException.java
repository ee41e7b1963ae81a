package uk.gegc.members.features.member.domain.exception;

public class MemberAlreadyExistsException extends RuntimeException {

    public MemberAlreadyExistsException(String email) {
        super("A member with email " + email + " already exists");
    }
}
