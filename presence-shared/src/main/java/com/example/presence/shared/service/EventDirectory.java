package com.example.presence.shared.service;

import com.example.presence.shared.model.EventContext;

import java.util.Optional;

public interface EventDirectory {

    /** Looks up an event that is currently active; ended or unknown events yield empty. */
    Optional<EventContext> findActiveEvent(String eventId);
}
