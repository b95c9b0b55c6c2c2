package com.example.presence.live.registry;

import java.util.Objects;
import java.util.Optional;

/**
 * Who a message is for: one user's personal connections, everyone watching one event,
 * or every connection in the cluster.
 */
public record AudienceKey(Scope scope, String id) {

    private static final String ALL_TOKEN = "all";

    public enum Scope {
        USER("user"),
        EVENT("event"),
        ALL(ALL_TOKEN);

        private final String prefix;

        Scope(String prefix) {
            this.prefix = prefix;
        }
    }

    public AudienceKey {
        Objects.requireNonNull(scope, "scope");
        if (scope != Scope.ALL && (id == null || id.isBlank())) {
            throw new IllegalArgumentException("Audience id is required for scope " + scope);
        }
        if (scope == Scope.ALL) {
            id = null;
        }
    }

    public static AudienceKey user(String userId) {
        return new AudienceKey(Scope.USER, userId);
    }

    public static AudienceKey event(String eventId) {
        return new AudienceKey(Scope.EVENT, eventId);
    }

    public static AudienceKey all() {
        return new AudienceKey(Scope.ALL, null);
    }

    /**
     * Inverse of {@link #toString()}; empty for anything that isn't a well-formed key.
     */
    public static Optional<AudienceKey> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        if (ALL_TOKEN.equals(value)) {
            return Optional.of(all());
        }
        int separator = value.indexOf(':');
        if (separator <= 0 || separator == value.length() - 1) {
            return Optional.empty();
        }
        String prefix = value.substring(0, separator);
        String id = value.substring(separator + 1);
        if (Scope.USER.prefix.equals(prefix)) {
            return Optional.of(user(id));
        }
        if (Scope.EVENT.prefix.equals(prefix)) {
            return Optional.of(event(id));
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return scope == Scope.ALL ? ALL_TOKEN : scope.prefix + ":" + id;
    }
}
