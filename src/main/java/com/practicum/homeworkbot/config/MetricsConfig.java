package com.practicum.homeworkbot.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicLong cursor;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.cursor = registry.gauge("homework.poll.cursor", new AtomicLong(0));
    }

    public void recordCycle(String outcome) {
        Counter.builder("homework.poll.cycles")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordStatusChange(String verdict) {
        Counter.builder("homework.status.changes")
                .tag("verdict", verdict)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordFailure(String kind, boolean alerted) {
        Counter.builder("homework.poll.failures")
                .tag("kind", kind)
                .tag("alerted", String.valueOf(alerted))
                .register(registry)
                .increment();
    }

    public void updateCursor(long value) {
        cursor.set(value);
    }
}
