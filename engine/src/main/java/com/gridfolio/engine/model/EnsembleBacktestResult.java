package com.gridfolio.engine.model;

import java.util.List;

public record EnsembleBacktestResult(
        String portfolioName,
        List<PerformanceSummary> realizations,
        QuantileSummary annualizedReturn,
        QuantileSummary maxDrawdown,
        double pooledValueAtRisk,
        double pooledConditionalValueAtRisk
) {

    public EnsembleBacktestResult {
        realizations = List.copyOf(realizations);
    }
}
