package com.example.presence.shared.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the presence service: bus traffic, connection churn and commentary output.
 */
@Configuration
@EnableAspectJAutoProxy
public class MonitoringConfig {

    public static final String BUS_PUBLISHED = "presence.bus.published";
    public static final String BUS_LOCAL_FALLBACK = "presence.bus.local_fallback";
    public static final String BUS_REPLAYED = "presence.bus.replayed";
    public static final String CONNECTIONS_PRUNED = "presence.connections.pruned";
    public static final String CONNECTIONS_ACTIVE = "presence.connections.active";
    public static final String HANDSHAKES_REJECTED = "presence.handshakes.rejected";
    public static final String COMMENTARY_GENERATED = "presence.commentary.generated";
    public static final String COMMENTARY_DROPPED = "presence.commentary.dropped";
    public static final String COMMENTARY_FAILED = "presence.commentary.failed";
    public static final String COMMENTARY_LATENCY = "presence.commentary.latency";

    @Bean
    public PresenceMetricsCollector presenceMetricsCollector(MeterRegistry registry) {
        PresenceMetricsCollector collector = new PresenceMetricsCollector(registry);
        // Registered up front so dashboards show zeros instead of gaps on a fresh pod
        collector.counter(BUS_LOCAL_FALLBACK);
        collector.counter(CONNECTIONS_PRUNED);
        collector.counter(COMMENTARY_DROPPED);
        collector.counter(COMMENTARY_FAILED);
        collector.setGauge(CONNECTIONS_ACTIVE, 0);
        return collector;
    }

    /**
     * Meter lookups keyed by name plus tag pairs, so the per-message paths reuse meters instead of
     * asking the registry each time.
     */
    public static class PresenceMetricsCollector {

        private final MeterRegistry registry;
        private final Map<List<String>, Counter> counters = new ConcurrentHashMap<>();
        private final Map<List<String>, Timer> timers = new ConcurrentHashMap<>();
        private final Map<List<String>, AtomicLong> gauges = new ConcurrentHashMap<>();

        public PresenceMetricsCollector(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            counter(name, tags).increment();
        }

        public void recordTimer(String name, long millis, String... tags) {
            timers.computeIfAbsent(meterKey(name, tags), key -> Timer.builder(name)
                            .tags(tags)
                            .publishPercentileHistogram(false)
                            .register(registry))
                    .record(Duration.ofMillis(millis));
        }

        public void setGauge(String name, long value, String... tags) {
            gauges.computeIfAbsent(meterKey(name, tags), key -> {
                AtomicLong holder = new AtomicLong();
                Gauge.builder(name, holder, AtomicLong::get).tags(tags).register(registry);
                return holder;
            }).set(value);
        }

        public long getCounterValue(String name, String... tags) {
            Counter counter = counters.get(meterKey(name, tags));
            return counter == null ? 0 : (long) counter.count();
        }

        public long getGaugeValue(String name, String... tags) {
            AtomicLong holder = gauges.get(meterKey(name, tags));
            return holder == null ? 0 : holder.get();
        }

        Counter counter(String name, String... tags) {
            return counters.computeIfAbsent(meterKey(name, tags), key -> registry.counter(name, tags));
        }

        private static List<String> meterKey(String name, String... tags) {
            List<String> key = new ArrayList<>(tags.length + 1);
            key.add(name);
            key.addAll(Arrays.asList(tags));
            return key;
        }
    }
}
