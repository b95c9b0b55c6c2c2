package com.example.presence.live.transport;

import com.example.presence.shared.exception.HandshakeRejectedException;
import com.example.presence.shared.util.Constants;
import org.springframework.http.HttpHeaders;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriTemplate;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * What a client presented when opening {@code /ws/events/{eventId}}: either a bearer token (header
 * or {@code token} query parameter) or a guest id plus display name.
 */
public record HandshakeRequest(String eventId, String token, String guestId, String guestName) {

    static final UriTemplate EVENT_PATH = new UriTemplate("/ws/events/{eventId}");
    private static final String BEARER_PREFIX = "Bearer ";

    public boolean isMember() {
        return StringUtils.hasText(token);
    }

    public static HandshakeRequest from(HandshakeInfo info) {
        Map<String, String> variables = EVENT_PATH.match(info.getUri().getPath());
        String eventId = variables.get("eventId");
        if (!StringUtils.hasText(eventId)) {
            throw new HandshakeRejectedException(Constants.CloseCodes.BAD_HANDSHAKE, "Missing event id");
        }
        MultiValueMap<String, String> query = UriComponentsBuilder.fromUri(info.getUri()).build(true)
                .getQueryParams();
        String token = bearerToken(info.getHeaders());
        if (token == null) {
            token = decoded(query.getFirst("token"));
        }
        String guestId = decoded(query.getFirst("guest_id"));
        String guestName = decoded(query.getFirst("name"));
        if (!StringUtils.hasText(token) && (!StringUtils.hasText(guestId) || !StringUtils.hasText(guestName))) {
            throw new HandshakeRejectedException(Constants.CloseCodes.BAD_HANDSHAKE,
                    "Either a bearer token or guest_id and name are required");
        }
        return new HandshakeRequest(eventId, token, guestId, guestName);
    }

    static String bearerToken(HttpHeaders headers) {
        String authorization = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }

    /** Percent-decoded value of a query parameter, or null when absent. */
    static String queryParam(URI uri, String name) {
        return decoded(UriComponentsBuilder.fromUri(uri).build(true).getQueryParams().getFirst(name));
    }

    private static String decoded(String value) {
        return value == null ? null : UriUtils.decode(value, StandardCharsets.UTF_8);
    }
}
