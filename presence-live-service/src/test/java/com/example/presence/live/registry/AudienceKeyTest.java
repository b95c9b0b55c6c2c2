package com.example.presence.live.registry;

import com.example.presence.live.support.TestProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AudienceKeyTest {

    @Test
    void shouldRenderAndParseEveryScope() {
        assertThat(AudienceKey.user("42")).hasToString("user:42");
        assertThat(AudienceKey.event("e-7")).hasToString("event:e-7");
        assertThat(AudienceKey.all()).hasToString("all");

        assertThat(AudienceKey.parse("user:42")).contains(AudienceKey.user("42"));
        assertThat(AudienceKey.parse("event:e-7")).contains(AudienceKey.event("e-7"));
        assertThat(AudienceKey.parse("all")).contains(AudienceKey.all());
    }

    @Test
    void idMayContainTheSeparator() {
        assertThat(AudienceKey.parse("event:a:b")).contains(AudienceKey.event("a:b"));
    }

    @Test
    void shouldRejectMalformedKeys() {
        assertThat(AudienceKey.parse(null)).isEmpty();
        assertThat(AudienceKey.parse("")).isEmpty();
        assertThat(AudienceKey.parse("user:")).isEmpty();
        assertThat(AudienceKey.parse(":42")).isEmpty();
        assertThat(AudienceKey.parse("room:42")).isEmpty();

        assertThatThrownBy(() -> AudienceKey.user(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void channelNamerShouldRoundTripThroughThePrefix() {
        ChannelNamer namer = new ChannelNamer(TestProperties.appProperties("pod-a"));

        assertThat(namer.channelFor(AudienceKey.event("e1"))).isEqualTo("presence:event:e1");
        assertThat(namer.audienceKeyOf("presence:user:u1")).contains(AudienceKey.user("u1"));
        assertThat(namer.audienceKeyOf("presence:all")).contains(AudienceKey.all());
        assertThat(namer.audienceKeyOf("other:event:e1")).isEmpty();
    }
}
