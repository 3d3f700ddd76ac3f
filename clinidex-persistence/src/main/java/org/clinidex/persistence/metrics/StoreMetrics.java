package org.clinidex.persistence.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.clinidex.core.document.HistoryOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Records store activity when a MeterRegistry is available.
 */
@Component
public class StoreMetrics {

    private static final Logger log = LoggerFactory.getLogger(StoreMetrics.class);

    private final MeterRegistry meterRegistry;

    public StoreMetrics(@Autowired(required = false) MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        if (meterRegistry == null) {
            log.debug("MeterRegistry is null - store metrics will not be recorded");
        }
    }

    public void recordWrite(String type, HistoryOperation operation) {
        if (meterRegistry == null) {
            return;
        }
        Counter.builder("clinidex.writes")
                .description("Committed document versions")
                .tag("type", type)
                .tag("operation", operation.getCode())
                .register(meterRegistry)
                .increment();
    }

    public void recordConflict(String type) {
        if (meterRegistry == null) {
            return;
        }
        Counter.builder("clinidex.conflicts")
                .description("Writes rejected by the expected-version check or a concurrent writer")
                .tag("type", type)
                .register(meterRegistry)
                .increment();
    }

    public void recordExtractionFailure(String type, String ruleName) {
        if (meterRegistry == null) {
            return;
        }
        Counter.builder("clinidex.extraction.failures")
                .description("Writes rolled back because a search rule could not convert a value")
                .tag("type", type)
                .tag("rule", ruleName != null ? ruleName : "unknown")
                .register(meterRegistry)
                .increment();
    }

    public void recordSearch(String type, long durationNanos) {
        if (meterRegistry == null) {
            return;
        }
        Timer.builder("clinidex.search")
                .description("Search execution time, hydration and includes included")
                .tag("type", type)
                .register(meterRegistry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
