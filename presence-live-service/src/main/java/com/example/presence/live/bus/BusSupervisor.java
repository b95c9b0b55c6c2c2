package com.example.presence.live.bus;

import com.example.presence.live.registry.ConnectionRegistry;
import com.example.presence.shared.config.AppProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Reconnect loop for the channel bus. Probes the bus at a fixed backoff, flags the registry when it
 * goes away and triggers a resubscribe from current registry state when it comes back.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BusSupervisor {

    private final ChannelBus channelBus;
    private final ConnectionRegistry connectionRegistry;
    private final AppProperties appProperties;

    private Disposable probeSubscription;

    @PostConstruct
    public void start() {
        Duration backoff = Duration.ofMillis(appProperties.getBus().getReconnectBackoff());
        probeSubscription = Flux.interval(backoff, backoff, Schedulers.boundedElastic())
                .doOnNext(tick -> probe())
                .subscribe();
        log.info("Bus supervisor started with a {} ms probe interval", backoff.toMillis());
    }

    @PreDestroy
    public void stop() {
        if (probeSubscription != null && !probeSubscription.isDisposed()) {
            probeSubscription.dispose();
            log.info("Bus supervisor stopped.");
        }
    }

    void probe() {
        try {
            boolean reachable = channelBus.ping();
            if (!reachable) {
                connectionRegistry.markBusDown();
            } else if (!connectionRegistry.isBusAvailable()) {
                connectionRegistry.onBusRestored();
            }
        } catch (Exception e) {
            log.warn("Bus recovery attempt failed, retrying after backoff: {}", e.getMessage());
            connectionRegistry.markBusDown();
        }
    }
}
