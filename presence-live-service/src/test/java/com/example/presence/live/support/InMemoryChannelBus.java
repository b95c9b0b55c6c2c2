package com.example.presence.live.support;

import com.example.presence.live.bus.BusMessageHandler;
import com.example.presence.live.bus.ChannelBus;
import com.example.presence.shared.exception.BusUnavailableException;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Loop-back bus for tests. Several instances sharing one {@link Broker} behave like pods connected
 * to the same Redis; an unavailable instance neither sends nor receives.
 */
public class InMemoryChannelBus implements ChannelBus {

    public static class Broker {
        private final List<InMemoryChannelBus> members = new CopyOnWriteArrayList<>();
    }

    private final Broker broker;
    private final Map<String, BusMessageHandler> subscriptions = new ConcurrentHashMap<>();
    private final AtomicInteger published = new AtomicInteger();
    private volatile boolean available = true;

    public InMemoryChannelBus() {
        this(new Broker());
    }

    public InMemoryChannelBus(Broker broker) {
        this.broker = broker;
        broker.members.add(this);
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public int publishedCount() {
        return published.get();
    }

    @Override
    public void publish(String channel, String payload) {
        ensureAvailable();
        published.incrementAndGet();
        for (InMemoryChannelBus member : broker.members) {
            if (!member.available) {
                continue;
            }
            BusMessageHandler handler = member.subscriptions.get(channel);
            if (handler != null) {
                handler.onMessage(channel, payload);
            }
        }
    }

    @Override
    public void subscribe(String channel, BusMessageHandler handler) {
        ensureAvailable();
        subscriptions.put(channel, handler);
    }

    @Override
    public void unsubscribe(String channel) {
        ensureAvailable();
        subscriptions.remove(channel);
    }

    @Override
    public void resubscribe(Set<String> channels, BusMessageHandler handler) {
        ensureAvailable();
        subscriptions.keySet().retainAll(new HashSet<>(channels));
        channels.forEach(channel -> subscriptions.putIfAbsent(channel, handler));
    }

    @Override
    public Set<String> subscribedChannels() {
        return Set.copyOf(subscriptions.keySet());
    }

    @Override
    public boolean ping() {
        return available;
    }

    private void ensureAvailable() {
        if (!available) {
            throw new BusUnavailableException("in-memory bus is down", null);
        }
    }
}
