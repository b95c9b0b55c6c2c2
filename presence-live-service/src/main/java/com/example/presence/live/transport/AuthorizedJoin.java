package com.example.presence.live.transport;

import com.example.presence.live.session.Participant;
import com.example.presence.shared.model.EventContext;

/**
 * @param connectionIdentity user id for members, the event id for anonymous guests
 */
public record AuthorizedJoin(EventContext event, Participant participant, String connectionIdentity) {
}
