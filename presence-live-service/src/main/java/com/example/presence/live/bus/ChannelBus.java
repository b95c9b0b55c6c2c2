package com.example.presence.live.bus;

import com.example.presence.shared.exception.BusUnavailableException;

import java.util.Set;

/**
 * Cluster-wide publish/subscribe for small JSON payloads. At-most-once, no ordering across
 * publishers. Every pod holds one subscription per channel that has local members.
 */
public interface ChannelBus {

    /**
     * @throws BusUnavailableException if the bus cannot be reached
     */
    void publish(String channel, String payload);

    void subscribe(String channel, BusMessageHandler handler);

    /** No-op for channels that aren't subscribed. */
    void unsubscribe(String channel);

    /**
     * Makes the subscribed channel set equal to {@code channels}: drops the extras, adds the missing.
     */
    void resubscribe(Set<String> channels, BusMessageHandler handler);

    Set<String> subscribedChannels();

    /** Round-trip check used by the reconnect loop. */
    boolean ping();
}
