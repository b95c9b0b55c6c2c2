package com.example.presence.live.registry;

import com.example.presence.live.bus.BusMessageHandler;
import com.example.presence.live.bus.ChannelBus;
import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.config.MonitoringConfig;
import com.example.presence.shared.exception.BusUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Per-pod map of live connections keyed by audience. Outbound messages always go through the bus so
 * local and remote audiences are served by the same listener path; inbound bus messages are fanned
 * out to the local connections under the decoded key.
 */
@Service
@Slf4j
public class ConnectionRegistry implements BusMessageHandler {

    private final Map<AudienceKey, Set<Connection>> audiences = new ConcurrentHashMap<>();
    // Guards the "first member subscribes / last member unsubscribes" transitions
    private final Object membershipLock = new Object();
    private final AtomicBoolean busAvailable = new AtomicBoolean(true);
    private final Deque<PendingPublish> replayBuffer = new ArrayDeque<>();

    private final ChannelBus channelBus;
    private final ChannelNamer channelNamer;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;
    private final MonitoringConfig.PresenceMetricsCollector metricsCollector;

    public ConnectionRegistry(ChannelBus channelBus,
                              ChannelNamer channelNamer,
                              ObjectMapper objectMapper,
                              AppProperties appProperties,
                              MonitoringConfig.PresenceMetricsCollector metricsCollector) {
        this.channelBus = channelBus;
        this.channelNamer = channelNamer;
        this.objectMapper = objectMapper;
        this.appProperties = appProperties;
        this.metricsCollector = metricsCollector;
    }

    public void register(Connection connection, AudienceKey key) {
        boolean first;
        synchronized (membershipLock) {
            Set<Connection> members = audiences.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet());
            first = members.isEmpty();
            members.add(connection);
        }
        // membershipLock is never held across a bus round trip
        if (first && busAvailable.get()) {
            subscribe(key);
        }
        log.debug("Registered {} under {}", connection, key);
        updateGauge();
    }

    public void unregister(Connection connection, AudienceKey key) {
        boolean removed = false;
        synchronized (membershipLock) {
            Set<Connection> members = audiences.get(key);
            if (members != null) {
                removed = members.remove(connection);
                if (members.isEmpty()) {
                    audiences.remove(key);
                    unsubscribeQuietly(key);
                }
            }
        }
        if (removed) {
            log.debug("Unregistered {} from {}", connection, key);
            updateGauge();
        }
    }

    public void publish(AudienceKey key, Object message) {
        publish(List.of(key), message);
    }

    /**
     * Publishes one message to several audiences. A connection that sits under more than one of
     * the keys receives it once.
     */
    public void publish(List<AudienceKey> keys, Object message) {
        String body = serialize(message);
        if (body == null) {
            return;
        }
        BusEnvelope envelope = new BusEnvelope(UUID.randomUUID().toString(), appProperties.getPodName(), body, false);
        String encoded = serialize(envelope);
        for (AudienceKey key : new LinkedHashSet<>(keys)) {
            publishEnvelope(key, envelope, encoded);
        }
    }

    public void publishBroadcast(Object message) {
        publish(AudienceKey.all(), message);
    }

    /**
     * Sends directly to one connection, bypassing the bus. Used for per-connection replies such as
     * the initial snapshot.
     */
    public boolean sendTo(Connection connection, Object message) {
        String body = serialize(message);
        return body != null && connection.send(body);
    }

    @Override
    public void onMessage(String channel, String payload) {
        Optional<AudienceKey> key = channelNamer.audienceKeyOf(channel);
        if (key.isEmpty()) {
            log.warn("Ignoring bus message on unrecognised channel {}", channel);
            return;
        }
        BusEnvelope envelope;
        try {
            envelope = objectMapper.readValue(payload, BusEnvelope.class);
        } catch (JsonProcessingException e) {
            log.warn("Discarding malformed bus message on {}: {}", channel, e.getOriginalMessage());
            return;
        }
        if (envelope.replay() && appProperties.getPodName().equals(envelope.origin())) {
            // Already delivered here when it was first published
            return;
        }
        deliverLocally(key.get(), envelope);
    }

    public void markBusDown() {
        if (busAvailable.compareAndSet(true, false)) {
            log.warn("Channel bus unavailable. Publishing degrades to local delivery ({}).",
                    appProperties.getBus().getDegradedMode());
        }
    }

    /**
     * Resubscribes to exactly the channels of the keys registered right now, then flushes any
     * messages buffered while the bus was down.
     */
    public void onBusRestored() {
        synchronized (membershipLock) {
            Set<String> channels = audiences.keySet().stream()
                    .map(channelNamer::channelFor)
                    .collect(Collectors.toSet());
            channelBus.resubscribe(channels, this);
            busAvailable.set(true);
        }
        log.info("Channel bus restored. Resubscribed to {} audience channels.", audiences.size());
        replayBuffered();
    }

    public boolean isBusAvailable() {
        return busAvailable.get();
    }

    public int connectionCount() {
        return (int) audiences.values().stream()
                .flatMap(Set::stream)
                .distinct()
                .count();
    }

    public int audienceCount() {
        return audiences.size();
    }

    public int replayBacklog() {
        synchronized (replayBuffer) {
            return replayBuffer.size();
        }
    }

    /** Snapshot of the connections currently held under {@code key}. */
    public Set<Connection> connectionsFor(AudienceKey key) {
        Set<Connection> members = audiences.get(key);
        return members == null ? Set.of() : Set.copyOf(members);
    }

    @PreDestroy
    public void closeAll() {
        log.info("Closing {} local connections across {} audiences", connectionCount(), audiences.size());
        audiences.values().stream()
                .flatMap(Set::stream)
                .distinct()
                .forEach(Connection::close);
    }

    private void publishEnvelope(AudienceKey key, BusEnvelope envelope, String encoded) {
        if (busAvailable.get()) {
            try {
                channelBus.publish(channelNamer.channelFor(key), encoded);
                metricsCollector.incrementCounter(MonitoringConfig.BUS_PUBLISHED, "scope", key.scope().name());
                return;
            } catch (BusUnavailableException e) {
                log.warn("Bus publish to {} failed: {}", key, e.getMessage());
                markBusDown();
            }
        }
        metricsCollector.incrementCounter(MonitoringConfig.BUS_LOCAL_FALLBACK, "scope", key.scope().name());
        deliverLocally(key, envelope);
        if (appProperties.getBus().getDegradedMode() == AppProperties.DegradedMode.LOCAL_AND_REPLAY) {
            buffer(new PendingPublish(key, envelope));
        }
    }

    private void deliverLocally(AudienceKey key, BusEnvelope envelope) {
        Set<Connection> members = audiences.get(key);
        if (members == null || members.isEmpty()) {
            return;
        }
        List<Connection> dead = new ArrayList<>();
        for (Connection connection : members) {
            if (!connection.deliver(envelope.id(), envelope.body())) {
                dead.add(connection);
            }
        }
        for (Connection connection : dead) {
            log.info("Pruning dead connection {} from {}", connection, key);
            unregister(connection, key);
            metricsCollector.incrementCounter(MonitoringConfig.CONNECTIONS_PRUNED);
        }
    }

    private void buffer(PendingPublish pending) {
        synchronized (replayBuffer) {
            if (replayBuffer.size() >= appProperties.getBus().getReplayBufferSize()) {
                replayBuffer.pollFirst();
            }
            replayBuffer.addLast(pending);
        }
    }

    private void replayBuffered() {
        List<PendingPublish> pending;
        synchronized (replayBuffer) {
            pending = new ArrayList<>(replayBuffer);
            replayBuffer.clear();
        }
        for (int i = 0; i < pending.size(); i++) {
            PendingPublish item = pending.get(i);
            String encoded = serialize(item.envelope().asReplay());
            if (encoded == null) {
                continue;
            }
            try {
                channelBus.publish(channelNamer.channelFor(item.key()), encoded);
                metricsCollector.incrementCounter(MonitoringConfig.BUS_REPLAYED);
            } catch (BusUnavailableException e) {
                log.warn("Replay interrupted after {} of {} messages: {}", i, pending.size(), e.getMessage());
                markBusDown();
                synchronized (replayBuffer) {
                    for (int j = pending.size() - 1; j >= i; j--) {
                        replayBuffer.addFirst(pending.get(j));
                    }
                }
                return;
            }
        }
        if (!pending.isEmpty()) {
            log.info("Replayed {} messages buffered while the bus was unavailable", pending.size());
        }
    }

    private void subscribe(AudienceKey key) {
        try {
            channelBus.subscribe(channelNamer.channelFor(key), this);
        } catch (BusUnavailableException e) {
            // The reconnect loop subscribes every current key once the bus is back
            log.warn("Could not subscribe to {} ({}). Delivery stays local until the bus recovers.", key, e.getMessage());
            markBusDown();
            return;
        }
        synchronized (membershipLock) {
            if (!audiences.containsKey(key)) {
                // Emptied while we were subscribing
                unsubscribeQuietly(key);
            }
        }
    }

    private void unsubscribeQuietly(AudienceKey key) {
        if (!busAvailable.get()) {
            return;
        }
        try {
            channelBus.unsubscribe(channelNamer.channelFor(key));
        } catch (BusUnavailableException e) {
            log.warn("Could not unsubscribe from {} ({}).", key, e.getMessage());
            markBusDown();
        }
    }

    private String serialize(Object message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {}: {}", message.getClass().getSimpleName(), e.getMessage());
            return null;
        }
    }

    private void updateGauge() {
        metricsCollector.setGauge(MonitoringConfig.CONNECTIONS_ACTIVE, connectionCount());
    }

    private record PendingPublish(AudienceKey key, BusEnvelope envelope) {}
}
