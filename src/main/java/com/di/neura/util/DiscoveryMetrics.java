package com.di.neura.util;

import com.di.neura.discovery.model.Status;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Metrics for discovery runs: run duration and outcome, rows per status,
 * bytes fingerprinted.
 */
@Slf4j
@Component
public class DiscoveryMetrics {

    private final Timer               runTimer;
    private final Counter             runSuccessCounter;
    private final Counter             runFailureCounter;
    private final DistributionSummary fingerprintedBytes;
    private final Map<Status, Counter> rowCounters = new EnumMap<>(Status.class);

    public DiscoveryMetrics(MeterRegistry meterRegistry) {
        this.runTimer = Timer.builder("neura.discovery.run.duration")
                .description("Wall-clock duration of a discovery run")
                .register(meterRegistry);

        this.runSuccessCounter = Counter.builder("neura.discovery.run.total")
                .description("Total number of discovery runs")
                .tag("outcome", "success")
                .register(meterRegistry);

        this.runFailureCounter = Counter.builder("neura.discovery.run.total")
                .description("Total number of discovery runs")
                .tag("outcome", "failure")
                .register(meterRegistry);

        this.fingerprintedBytes = DistributionSummary.builder("neura.discovery.fingerprinted.bytes")
                .description("Bytes covered by episode fingerprints per run")
                .baseUnit("bytes")
                .register(meterRegistry);

        for (Status status : Status.values()) {
            rowCounters.put(status, Counter.builder("neura.discovery.rows")
                    .description("Manifest rows emitted, by status")
                    .tag("status", status.name())
                    .register(meterRegistry));
        }
    }

    public void recordRunSuccess(long durationMs, Map<Status, Integer> statusCounts, long bytesTotal) {
        runTimer.record(durationMs, TimeUnit.MILLISECONDS);
        runSuccessCounter.increment();
        fingerprintedBytes.record(bytesTotal);
        statusCounts.forEach((status, count) -> rowCounters.get(status).increment(count));
        log.debug("Recorded discovery run: duration={}ms bytes={} counts={}", durationMs, bytesTotal, statusCounts);
    }

    public void recordRunFailure(long durationMs) {
        runTimer.record(durationMs, TimeUnit.MILLISECONDS);
        runFailureCounter.increment();
    }
}
