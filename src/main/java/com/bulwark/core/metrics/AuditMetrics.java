package com.bulwark.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for audit runs.
 */
@Service
public class AuditMetrics {

    private final MeterRegistry registry;

    public AuditMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCheckScore(String check, int score) {
        DistributionSummary.builder("bulwark.check.score")
                .tag("check", check)
                .register(registry)
                .record(score);
    }

    public void recordCheckDuration(String check, long ms) {
        Timer.builder("bulwark.check.duration")
                .tag("check", check)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Counts checks whose evaluation threw and was converted to a system error.
     */
    public void recordCheckFailure(String check) {
        Counter.builder("bulwark.check.failures")
                .tag("check", check)
                .register(registry)
                .increment();
    }

    public void recordIssues(String severity, int count) {
        Counter.builder("bulwark.issues.total")
                .tag("severity", severity)
                .register(registry)
                .increment(count);
    }

    public void recordRunResult(String status) {
        Counter.builder("bulwark.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
