package com.example.presence.shared.aspect;

import com.example.presence.shared.config.MonitoringConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MonitoringAspectTest {

    @Monitored("collaborator")
    public static class FlakyDirectory {
        public String lookup(String id) {
            if (id.isEmpty()) {
                throw new IllegalArgumentException("empty id");
            }
            return "event-" + id;
        }
    }

    private MonitoringConfig.PresenceMetricsCollector metrics;
    private FlakyDirectory proxy;

    @BeforeEach
    void setUp() {
        metrics = new MonitoringConfig.PresenceMetricsCollector(new SimpleMeterRegistry());
        AspectJProxyFactory factory = new AspectJProxyFactory(new FlakyDirectory());
        factory.setProxyTargetClass(true);
        factory.addAspect(new MonitoringAspect(metrics));
        proxy = factory.getProxy();
    }

    @Test
    void shouldCountSuccessesAndFailuresSeparately() {
        assertThat(proxy.lookup("1")).isEqualTo("event-1");
        assertThat(proxy.lookup("2")).isEqualTo("event-2");
        assertThatThrownBy(() -> proxy.lookup("")).isInstanceOf(IllegalArgumentException.class);

        assertThat(metrics.getCounterValue("presence.collaborator.calls",
                "collaborator", "FlakyDirectory", "operation", "lookup", "outcome", "success")).isEqualTo(2);
        assertThat(metrics.getCounterValue("presence.collaborator.calls",
                "collaborator", "FlakyDirectory", "operation", "lookup", "outcome", "error")).isEqualTo(1);
    }
}
