package com.example.presence.live.session;

import com.example.presence.live.registry.AudienceKey;
import com.example.presence.shared.util.Constants.ParticipantKind;
import com.example.presence.shared.util.Constants.SenderKind;

/**
 * Who is behind a connection: a signed-in member, or an anonymous guest identified by the
 * client-supplied session id.
 */
public record Participant(ParticipantKind kind, String id, String displayName) {

    public static Participant member(String userId, String displayName) {
        return new Participant(ParticipantKind.MEMBER, userId, displayName);
    }

    public static Participant guest(String guestId, String displayName) {
        return new Participant(ParticipantKind.GUEST, guestId, displayName);
    }

    public boolean isMember() {
        return kind == ParticipantKind.MEMBER;
    }

    public SenderKind senderKind() {
        return isMember() ? SenderKind.MEMBER : SenderKind.GUEST;
    }

    /** Key of the per-event live record; guest and member ids live in separate namespaces. */
    public String key() {
        return kind.name() + ":" + id;
    }

    /** Personal notification audience, members only. */
    public AudienceKey personalAudience() {
        return isMember() ? AudienceKey.user(id) : null;
    }
}
