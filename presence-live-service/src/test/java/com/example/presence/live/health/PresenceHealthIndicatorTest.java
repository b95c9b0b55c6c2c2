package com.example.presence.live.health;

import com.example.presence.live.commentary.CommentaryEngineManager;
import com.example.presence.live.registry.ConnectionRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PresenceHealthIndicatorTest {

    @Mock
    private ConnectionRegistry connectionRegistry;
    @Mock
    private CommentaryEngineManager commentaryEngines;
    @InjectMocks
    private PresenceHealthIndicator indicator;

    @Test
    void shouldBeUpWithCountsWhileTheBusIsReachable() {
        when(connectionRegistry.isBusAvailable()).thenReturn(true);
        when(connectionRegistry.connectionCount()).thenReturn(3);
        when(connectionRegistry.audienceCount()).thenReturn(2);
        when(commentaryEngines.activeEngineCount()).thenReturn(1);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("busStatus", "UP")
                .containsEntry("connections", 3)
                .containsEntry("audiences", 2)
                .containsEntry("commentaryEngines", 1);
    }

    @Test
    void shouldBeDownWhenTheBusIsUnavailable() {
        when(connectionRegistry.isBusAvailable()).thenReturn(false);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("busMode", "local delivery only");
    }
}
