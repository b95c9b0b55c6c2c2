package com.example.presence.live.bus;

import com.example.presence.shared.exception.BusUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Redis Pub/Sub implementation of the channel bus.
 */
@Component
@Slf4j
public class RedisChannelBus implements ChannelBus {

    private final StringRedisTemplate pubSubRedisTemplate;
    private final RedisMessageListenerContainer listenerContainer;
    private final Map<String, MessageListener> listeners = new ConcurrentHashMap<>();

    public RedisChannelBus(@Qualifier("pubSubRedisTemplate") StringRedisTemplate pubSubRedisTemplate,
                           RedisMessageListenerContainer listenerContainer) {
        this.pubSubRedisTemplate = pubSubRedisTemplate;
        this.listenerContainer = listenerContainer;
    }

    @Override
    public void publish(String channel, String payload) {
        try {
            pubSubRedisTemplate.convertAndSend(channel, payload);
        } catch (DataAccessException e) {
            throw new BusUnavailableException("Redis publish failed on channel " + channel, e);
        }
    }

    @Override
    public void subscribe(String channel, BusMessageHandler handler) {
        MessageListener listener = listeners.computeIfAbsent(channel, c -> toListener(handler));
        try {
            listenerContainer.addMessageListener(listener, new ChannelTopic(channel));
            log.debug("Subscribed to channel {}", channel);
        } catch (DataAccessException e) {
            throw new BusUnavailableException("Redis subscribe failed on channel " + channel, e);
        }
    }

    @Override
    public void unsubscribe(String channel) {
        MessageListener listener = listeners.remove(channel);
        if (listener == null) {
            return;
        }
        try {
            listenerContainer.removeMessageListener(listener, new ChannelTopic(channel));
            log.debug("Unsubscribed from channel {}", channel);
        } catch (DataAccessException e) {
            throw new BusUnavailableException("Redis unsubscribe failed on channel " + channel, e);
        }
    }

    @Override
    public void resubscribe(Set<String> channels, BusMessageHandler handler) {
        for (String stale : new HashSet<>(listeners.keySet())) {
            if (!channels.contains(stale)) {
                unsubscribe(stale);
            }
        }
        for (String channel : channels) {
            MessageListener existing = listeners.get(channel);
            if (existing != null) {
                // Re-adding an existing listener for its topic is idempotent in the container
                listenerContainer.addMessageListener(existing, new ChannelTopic(channel));
            } else {
                subscribe(channel, handler);
            }
        }
        log.info("Resubscribed to {} channels", channels.size());
    }

    @Override
    public Set<String> subscribedChannels() {
        return Set.copyOf(listeners.keySet());
    }

    @Override
    public boolean ping() {
        try {
            String pong = pubSubRedisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong);
        } catch (Exception e) {
            log.debug("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    private MessageListener toListener(BusMessageHandler handler) {
        return (message, pattern) -> {
            String channel = new String(message.getChannel(), StandardCharsets.UTF_8);
            String payload = new String(message.getBody(), StandardCharsets.UTF_8);
            try {
                handler.onMessage(channel, payload);
            } catch (Exception e) {
                log.error("Failed to dispatch bus message from channel '{}'. Root cause: {}", channel, e.getMessage(), e);
            }
        };
    }
}
