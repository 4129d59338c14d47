package com.gridfolio.engine.model;

import lombok.Builder;

import java.util.Map;

/**
 * Replay of one portfolio over one realized return path.
 */
@Builder
public record BacktestResult(
        String portfolioName,
        Map<String, Double> weights,
        TimeSeries returns,
        TimeSeries equityCurve,
        TimeSeries drawdown,
        PerformanceSummary summary
) {
}
