package com.example.presence.live.registry;

import com.example.presence.shared.config.AppProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Maps audience keys to bus channel names and back, e.g. {@code presence:event:42}.
 */
@Component
@RequiredArgsConstructor
public class ChannelNamer {

    private final AppProperties appProperties;

    public String channelFor(AudienceKey key) {
        return prefix() + key;
    }

    public Optional<AudienceKey> audienceKeyOf(String channel) {
        if (channel == null || !channel.startsWith(prefix())) {
            return Optional.empty();
        }
        return AudienceKey.parse(channel.substring(prefix().length()));
    }

    private String prefix() {
        return appProperties.getBus().getChannelPrefix() + ":";
    }
}
