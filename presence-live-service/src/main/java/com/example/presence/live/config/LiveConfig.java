package com.example.presence.live.config;

import com.example.presence.shared.config.AppProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class LiveConfig {

    public static final String HANDSHAKE_LIMITER = "presenceHandshakeLimiter";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Caps new WebSocket connections per second on this pod. Excess attempts fail immediately
     * rather than queueing.
     */
    @Bean
    public RateLimiter handshakeRateLimiter(RateLimiterRegistry rateLimiterRegistry, AppProperties appProperties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(appProperties.getSession().getHandshakeRateLimit())
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(Duration.ZERO)
                .build();
        return rateLimiterRegistry.rateLimiter(HANDSHAKE_LIMITER, config);
    }
}
