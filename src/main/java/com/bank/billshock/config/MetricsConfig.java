package com.bank.billshock.config;

import com.bank.billshock.model.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTrainingSuccess(int trainingSamples) {
        Counter.builder("billshock.training.count")
                .tag("status", "success")
                .tag("error", "none")
                .register(registry)
                .increment();

        DistributionSummary.builder("billshock.training.samples")
                .register(registry)
                .record(trainingSamples);
    }

    public void recordTrainingFailure(ErrorKind kind) {
        Counter.builder("billshock.training.count")
                .tag("status", "failure")
                .tag("error", kind.name())
                .register(registry)
                .increment();
    }

    public void recordContaminationFallback() {
        Counter.builder("billshock.training.contamination_fallback")
                .register(registry)
                .increment();
    }

    public void recordDetection(int totalRecords, int anomalyCount) {
        Counter.builder("billshock.detection.count")
                .tag("status", "success")
                .tag("error", "none")
                .register(registry)
                .increment();

        DistributionSummary.builder("billshock.detection.anomalies")
                .register(registry)
                .record(anomalyCount);

        Counter.builder("billshock.detection.records")
                .register(registry)
                .increment(totalRecords);
    }

    public void recordDetectionFailure(ErrorKind kind) {
        Counter.builder("billshock.detection.count")
                .tag("status", "failure")
                .tag("error", kind.name())
                .register(registry)
                .increment();
    }
}
