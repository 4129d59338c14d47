package com.gridfolio.engine.model;

import lombok.Builder;

@Builder
public record PerformanceSummary(
        int periods,
        double totalReturn,
        double annualizedReturn,
        double annualizedVolatility,
        double sharpe,
        double sortino,
        double calmar,
        double maxDrawdown,
        double valueAtRisk,
        double conditionalValueAtRisk,
        double varConfidence
) {
}
