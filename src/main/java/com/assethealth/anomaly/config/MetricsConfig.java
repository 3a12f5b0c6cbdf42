package com.assethealth.anomaly.config;

import com.assethealth.anomaly.model.PipelineStage;
import com.assethealth.anomaly.model.WarningType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRun(boolean criteriaPassed, int rows, Duration elapsed) {
        String outcome = criteriaPassed ? "passed" : "criteria_not_met";
        Counter.builder("analysis.run.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        DistributionSummary.builder("analysis.run.rows")
                .register(registry)
                .record(rows);

        Timer.builder("analysis.run.duration")
                .register(registry)
                .record(elapsed);
    }

    public void recordScore(double score) {
        DistributionSummary.builder("analysis.abnormality_score")
                .register(registry)
                .record(score);
    }

    public void recordFailure(PipelineStage stage) {
        Counter.builder("analysis.failure.count")
                .tag("stage", stage.name())
                .register(registry)
                .increment();
    }

    public void recordWarning(WarningType type) {
        Counter.builder("analysis.warning.count")
                .tag("type", type.name())
                .register(registry)
                .increment();
    }
}
