package uk.gegc.members.features.member.domain.model;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable view of the editable member fields, used to diff a member before and after an update.
 */
public record MemberSnapshot(String email, String name, String note, boolean subscribed) {

    public enum Field {
        EMAIL, NAME, NOTE, SUBSCRIBED
    }

    public static MemberSnapshot of(Member member) {
        return new MemberSnapshot(member.getEmail(), member.getName(), member.getNote(), member.isSubscribed());
    }

    /**
     * Fields whose value differs in {@code after}.
     */
    public Set<Field> changedFields(MemberSnapshot after) {
        Set<Field> changed = EnumSet.noneOf(Field.class);
        if (!Objects.equals(email, after.email)) {
            changed.add(Field.EMAIL);
        }
        if (!Objects.equals(name, after.name)) {
            changed.add(Field.NAME);
        }
        if (!Objects.equals(note, after.note)) {
            changed.add(Field.NOTE);
        }
        if (subscribed != after.subscribed) {
            changed.add(Field.SUBSCRIBED);
        }
        return changed;
    }
}
