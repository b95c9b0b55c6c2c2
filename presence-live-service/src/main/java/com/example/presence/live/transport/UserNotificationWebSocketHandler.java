package com.example.presence.live.transport;

import com.example.presence.live.registry.AudienceKey;
import com.example.presence.live.registry.Connection;
import com.example.presence.live.registry.ConnectionRegistry;
import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.config.MonitoringConfig;
import com.example.presence.shared.exception.HandshakeRejectedException;
import com.example.presence.shared.model.VerifiedIdentity;
import com.example.presence.shared.service.IdentityService;
import com.example.presence.shared.util.Constants;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.UUID;

/**
 * {@code /ws/users?token=...}: a signed-in user's personal notification stream, plus cluster-wide
 * broadcasts. No event state; the only thing a client can send is the liveness probe.
 */
@Component
@Slf4j
public class UserNotificationWebSocketHandler implements WebSocketHandler {

    private final IdentityService identityService;
    private final ConnectionRegistry connectionRegistry;
    private final AppProperties appProperties;
    private final RateLimiter handshakeRateLimiter;
    private final MonitoringConfig.PresenceMetricsCollector metricsCollector;
    private final Scheduler sessionScheduler;

    public UserNotificationWebSocketHandler(IdentityService identityService,
                                            ConnectionRegistry connectionRegistry,
                                            AppProperties appProperties,
                                            RateLimiter handshakeRateLimiter,
                                            MonitoringConfig.PresenceMetricsCollector metricsCollector,
                                            @Qualifier("sessionScheduler") Scheduler sessionScheduler) {
        this.identityService = identityService;
        this.connectionRegistry = connectionRegistry;
        this.appProperties = appProperties;
        this.handshakeRateLimiter = handshakeRateLimiter;
        this.metricsCollector = metricsCollector;
        this.sessionScheduler = sessionScheduler;
    }

    @Override
    public Mono<Void> handle(WebSocketSession webSocketSession) {
        return Mono.fromCallable(() -> verify(webSocketSession))
                .subscribeOn(sessionScheduler)
                .transformDeferred(RateLimiterOperator.of(handshakeRateLimiter))
                .onErrorMap(RequestNotPermitted.class, e -> new HandshakeRejectedException(
                        Constants.CloseCodes.RATE_LIMITED, "Too many connection attempts, retry shortly"))
                .flatMap(identity -> run(webSocketSession, identity))
                .onErrorResume(HandshakeRejectedException.class, e -> {
                    log.info("Rejected personal stream with {}: {}", e.getCloseCode(), e.getMessage());
                    metricsCollector.incrementCounter(MonitoringConfig.HANDSHAKES_REJECTED, "code", String.valueOf(e.getCloseCode()));
                    return webSocketSession.close(new CloseStatus(e.getCloseCode(), e.getMessage()));
                });
    }

    private VerifiedIdentity verify(WebSocketSession webSocketSession) {
        String token = HandshakeRequest.bearerToken(webSocketSession.getHandshakeInfo().getHeaders());
        if (token == null) {
            token = HandshakeRequest.queryParam(webSocketSession.getHandshakeInfo().getUri(), "token");
        }
        if (!StringUtils.hasText(token)) {
            throw new HandshakeRejectedException(Constants.CloseCodes.BAD_HANDSHAKE, "A token is required");
        }
        return identityService.verifyToken(token)
                .filter(VerifiedIdentity::active)
                .orElseThrow(() -> new HandshakeRejectedException(Constants.CloseCodes.INVALID_IDENTITY,
                        "Invalid or expired token"));
    }

    private Mono<Void> run(WebSocketSession webSocketSession, VerifiedIdentity identity) {
        AppProperties.Session settings = appProperties.getSession();
        Connection connection = new Connection(UUID.randomUUID().toString(), identity.userId(),
                settings.getOutboundBufferSize(), settings.getDedupeWindow());
        List<AudienceKey> keys = List.of(AudienceKey.user(identity.userId()), AudienceKey.all());
        keys.forEach(key -> connectionRegistry.register(connection, key));
        log.info("User {} opened personal stream {}", identity.userId(), connection.getConnectionId());

        Mono<Void> input = webSocketSession.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .filter(text -> Constants.PING.equals(text.trim()))
                .doOnNext(ping -> connection.send(Constants.PONG))
                .onErrorResume(e -> {
                    log.warn("Personal stream {} failed: {}", connection.getConnectionId(), e.getMessage());
                    return Mono.empty();
                })
                .doFinally(signal -> {
                    keys.forEach(key -> connectionRegistry.unregister(connection, key));
                    connection.close();
                    log.info("User {} closed personal stream {}", identity.userId(), connection.getConnectionId());
                })
                .then();

        Mono<Void> output = webSocketSession.send(connection.outbound().map(webSocketSession::textMessage))
                .then(Mono.defer(webSocketSession::close));

        return Mono.when(input, output);
    }
}
