package com.di.starnova.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics collector for pipeline runs: stage durations, run outcomes and data quality results.
 */
@Slf4j
@Component
public class MetricsCollector {

    private final MeterRegistry meterRegistry;

    // Run Metrics
    private final Counter runSuccessCounter;
    private final Counter runFailureCounter;
    private final Timer runTimer;

    // Data Quality Metrics
    private final Counter dqRulesEvaluatedCounter;
    private final Counter dqRulesFailedCounter;
    private final DistributionSummary dqViolationsDistribution;

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        // Run Metrics
        this.runSuccessCounter = Counter.builder("starnova.run.total")
                .description("Total number of pipeline runs")
                .tag("status", "success")
                .register(meterRegistry);

        this.runFailureCounter = Counter.builder("starnova.run.total")
                .description("Total number of pipeline runs")
                .tag("status", "error")
                .register(meterRegistry);

        this.runTimer = Timer.builder("starnova.run.duration")
                .description("Wall-clock time of a full pipeline run")
                .register(meterRegistry);

        // Data Quality Metrics
        this.dqRulesEvaluatedCounter = Counter.builder("starnova.dq.rules")
                .description("Data quality rules evaluated")
                .tag("outcome", "evaluated")
                .register(meterRegistry);

        this.dqRulesFailedCounter = Counter.builder("starnova.dq.rules")
                .description("Data quality rules that failed")
                .tag("outcome", "failed")
                .register(meterRegistry);

        this.dqViolationsDistribution = DistributionSummary.builder("starnova.dq.violations")
                .description("Violating rows per failed rule")
                .baseUnit("rows")
                .register(meterRegistry);
    }

    // ============================================================================
    // Run Metrics
    // ============================================================================

    /**
     * Records the duration of one pipeline stage.
     *
     * @param stage      stage name, used as the {@code stage} tag
     * @param durationMs time taken in milliseconds
     */
    public void recordStage(String stage, long durationMs) {
        Timer.builder("starnova.stage.duration")
                .description("Time taken by one pipeline stage")
                .tag("stage", stage)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("Recorded stage: stage={}, durationMs={}", stage, durationMs);
    }

    public void recordRunSuccess(long durationMs) {
        runSuccessCounter.increment();
        runTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordRunFailure(long durationMs) {
        runFailureCounter.increment();
        runTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    // ============================================================================
    // Data Quality Metrics
    // ============================================================================

    /**
     * Records one evaluated rule.
     *
     * @param failed         whether the rule failed
     * @param violationCount violating rows, recorded only for failed rules
     */
    public void recordRuleResult(boolean failed, long violationCount) {
        dqRulesEvaluatedCounter.increment();
        if (failed) {
            dqRulesFailedCounter.increment();
            dqViolationsDistribution.record(violationCount);
        }
    }

    /**
     * Records the row count of a produced table.
     */
    public void recordTableRows(String table, long rows) {
        DistributionSummary.builder("starnova.table.rows")
                .tag("table", table)
                .baseUnit("rows")
                .register(meterRegistry)
                .record(rows);
    }
}
