package com.example.presence.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Redis is used only as the channel bus between pods; nothing is stored in it.
 */
@Configuration
@Slf4j
public class RedisConfig {

    // Envelopes are JSON strings
    @Bean("pubSubRedisTemplate")
    public StringRedisTemplate pubSubRedisTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }

    /**
     * Listener container shared by the whole pod. Channels are added and removed at runtime as
     * local audiences appear and disappear.
     */
    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory connectionFactory,
                                                                       Executor busListenerExecutor,
                                                                       AppProperties appProperties) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.setTaskExecutor(busListenerExecutor);
        container.setRecoveryInterval(appProperties.getBus().getReconnectBackoff());
        container.setErrorHandler(e -> log.warn("Bus listener error: {}", e.getMessage()));
        return container;
    }

    /**
     * Runs local fan-out for inbound bus messages. Sends into connection buffers never block, so a
     * small pool keeps up with the whole pod.
     */
    @Bean
    public Executor busListenerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(5000);
        executor.setThreadNamePrefix("bus-listener-");
        executor.initialize();
        return executor;
    }
}
