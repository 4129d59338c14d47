package com.gridfolio.engine.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final AtomicReference<Double> selectedSharpe = new AtomicReference<>(0.0);
    private final AtomicReference<Double> selectedVolatility = new AtomicReference<>(0.0);

    private Counter volatilityFallbacksCounter;
    private Counter covarianceRegularizationsCounter;
    private Counter analysisFailuresCounter;

    @jakarta.annotation.PostConstruct
    void init() {
        volatilityFallbacksCounter = Counter.builder("volatility_fallbacks_total").register(meterRegistry);
        covarianceRegularizationsCounter = Counter.builder("covariance_regularizations_total").register(meterRegistry);
        analysisFailuresCounter = Counter.builder("analysis_failures_total").register(meterRegistry);
        Gauge.builder("portfolio_selected_sharpe", selectedSharpe, value -> value.get()).register(meterRegistry);
        Gauge.builder("portfolio_selected_volatility", selectedVolatility, value -> value.get()).register(meterRegistry);
    }

    /**
     * Runs one pipeline stage under the {@code engine_stage_duration} timer.
     */
    public <T> T time(String stage, Supplier<T> work) {
        Timer timer = Timer.builder("engine_stage_duration")
                .tag("stage", stage)
                .register(meterRegistry);
        long startNanos = System.nanoTime();
        try {
            return timer.record(work);
        } finally {
            log.debug("Stage {} took {} ms", stage, (System.nanoTime() - startNanos) / 1_000_000);
        }
    }

    public void recordVolatilityFallback() {
        if (volatilityFallbacksCounter != null) {
            volatilityFallbacksCounter.increment();
        }
    }

    public void recordCovarianceRegularization() {
        if (covarianceRegularizationsCounter != null) {
            covarianceRegularizationsCounter.increment();
        }
    }

    public void recordFailure(String stage) {
        if (analysisFailuresCounter != null) {
            analysisFailuresCounter.increment();
        }
        Counter.builder("analysis_stage_failures_total")
                .tag("stage", stage == null ? "unknown" : stage)
                .register(meterRegistry)
                .increment();
    }

    public void updateSelection(double sharpe, double volatility) {
        selectedSharpe.set(sharpe);
        selectedVolatility.set(volatility);
    }
}
