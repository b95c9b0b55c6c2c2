package com.example.presence.live.transport;

import com.example.presence.live.protocol.inbound.InboundMessageDecoder;
import com.example.presence.live.registry.Connection;
import com.example.presence.live.session.PresenceHub;
import com.example.presence.live.session.PresenceSession;
import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.config.MonitoringConfig;
import com.example.presence.shared.exception.HandshakeRejectedException;
import com.example.presence.shared.util.Constants;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * {@code /ws/events/{eventId}}: one presence session per accepted connection.
 * <p>
 * Inbound frames are decoded and handled sequentially on the session scheduler. When the inbound
 * side ends for any reason, including an unexpected error, the session runs its disconnect path.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EventPresenceWebSocketHandler implements WebSocketHandler {

    private final PresenceHandshakeService handshakeService;
    private final InboundMessageDecoder decoder;
    private final PresenceHub hub;
    private final RateLimiter handshakeRateLimiter;
    private final MonitoringConfig.PresenceMetricsCollector metricsCollector;

    @Override
    public Mono<Void> handle(WebSocketSession webSocketSession) {
        return Mono.defer(() -> handshakeService.authorize(HandshakeRequest.from(webSocketSession.getHandshakeInfo())))
                .transformDeferred(RateLimiterOperator.of(handshakeRateLimiter))
                .onErrorMap(RequestNotPermitted.class, e -> new HandshakeRejectedException(
                        Constants.CloseCodes.RATE_LIMITED, "Too many connection attempts, retry shortly"))
                .flatMap(join -> run(webSocketSession, join))
                .onErrorResume(HandshakeRejectedException.class, e -> reject(webSocketSession, e));
    }

    private Mono<Void> run(WebSocketSession webSocketSession, AuthorizedJoin join) {
        AppProperties.Session settings = hub.getAppProperties().getSession();
        Connection connection = new Connection(UUID.randomUUID().toString(), join.connectionIdentity(),
                settings.getOutboundBufferSize(), settings.getDedupeWindow());
        PresenceSession session = new PresenceSession(hub, connection, join.participant(), join.event(),
                () -> webSocketSession.close().subscribe());
        log.info("Accepted {} for event {} as {} {}", connection, join.event().getEventId(),
                join.participant().kind(), join.participant().id());

        Mono<Void> input = Mono.fromRunnable(session::activate)
                .subscribeOn(hub.getSessionScheduler())
                .thenMany(webSocketSession.receive()
                        .map(WebSocketMessage::getPayloadAsText)
                        .publishOn(hub.getSessionScheduler())
                        .map(decoder::decode)
                        .doOnNext(session::handle))
                .onErrorResume(e -> {
                    log.error("Session {} failed, disconnecting: {}", session, e.getMessage(), e);
                    return Mono.empty();
                })
                .doFinally(signal -> hub.getSessionScheduler().schedule(session::onTransportClosed))
                .then();

        Mono<Void> output = webSocketSession.send(connection.outbound().map(webSocketSession::textMessage))
                .then(Mono.defer(webSocketSession::close));

        return Mono.when(input, output);
    }

    private Mono<Void> reject(WebSocketSession webSocketSession, HandshakeRejectedException e) {
        log.info("Rejected connection to {} with {}: {}", webSocketSession.getHandshakeInfo().getUri().getPath(),
                e.getCloseCode(), e.getMessage());
        metricsCollector.incrementCounter(MonitoringConfig.HANDSHAKES_REJECTED, "code", String.valueOf(e.getCloseCode()));
        return webSocketSession.close(new CloseStatus(e.getCloseCode(), e.getMessage()));
    }
}
