package com.example.presence.live.registry;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One open client transport. Sends never block: payloads go into a bounded per-connection buffer
 * that the transport drains. A send that cannot be buffered marks the connection dead.
 */
@Slf4j
public class Connection {

    @Getter
    private final String connectionId;
    @Getter
    private final String identity;

    private final Sinks.Many<String> outbound;
    private final AtomicBoolean alive = new AtomicBoolean(true);
    private final Map<String, Boolean> recentMessageIds;

    public Connection(String connectionId, String identity, int bufferSize, int dedupeWindow) {
        this.connectionId = connectionId;
        this.identity = identity;
        this.outbound = Sinks.many().unicast().onBackpressureBuffer(Queues.<String>get(bufferSize).get());
        this.recentMessageIds = new LinkedHashMap<>(dedupeWindow * 2, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > dedupeWindow;
            }
        };
    }

    /**
     * Queues a payload for the client.
     *
     * @return false if the connection is (now) dead
     */
    public synchronized boolean send(String payload) {
        if (!alive.get()) {
            return false;
        }
        Sinks.EmitResult result = outbound.tryEmitNext(payload);
        if (result.isFailure()) {
            log.warn("Failed to emit to connection {} ({}). Result: {}", connectionId, identity, result);
            alive.set(false);
            outbound.tryEmitComplete();
            return false;
        }
        return true;
    }

    /**
     * Sends a bus message unless this connection already received the same message id
     * through another audience key.
     */
    public synchronized boolean deliver(String messageId, String payload) {
        if (messageId != null && recentMessageIds.put(messageId, Boolean.TRUE) != null) {
            return alive.get();
        }
        return send(payload);
    }

    public Flux<String> outbound() {
        return outbound.asFlux();
    }

    public boolean isAlive() {
        return alive.get();
    }

    public synchronized void close() {
        if (alive.getAndSet(false)) {
            outbound.tryEmitComplete();
        }
    }

    @Override
    public String toString() {
        return "Connection[" + connectionId + ", " + identity + "]";
    }
}
