package com.example.presence.live.registry;

/**
 * What travels on a bus channel. The id lets a connection that sits under several audience keys
 * recognise a message it has already been given.
 *
 * @param id     unique per publish call, shared by every channel the call fans out to
 * @param origin pod that published the message
 * @param body   the serialized client-facing message
 * @param replay set when the origin pod republishes a message it already delivered locally
 *               while the bus was down
 */
public record BusEnvelope(String id, String origin, String body, boolean replay) {

    public BusEnvelope asReplay() {
        return new BusEnvelope(id, origin, body, true);
    }
}
