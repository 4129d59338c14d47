package com.gridfolio.engine.model;

import lombok.Builder;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one end-to-end run, flattened for JSON rendering.
 */
@Builder
public record AnalysisReport(
        LocalDateTime start,
        int horizonHours,
        int ensembleSize,
        long seed,
        List<String> assets,
        Map<String, Double> expectedReturns,
        Map<String, Double> volatilities,
        List<FrontierPoint> frontier,
        Map<String, Double> selectedWeights,
        double selectedExpectedReturn,
        double selectedVolatility,
        double selectedSharpe,
        double deflatedSharpe,
        boolean covarianceRegularized,
        Map<String, PerformanceSummary> outOfSample,
        QuantileSummary ensembleAnnualizedReturn,
        QuantileSummary ensembleMaxDrawdown,
        double ensembleValueAtRisk,
        double ensembleConditionalValueAtRisk,
        List<StressTestResult> stressTests,
        String volatilityModel,
        boolean volatilityFallback,
        double unconditionalPriceVariance,
        double meanForecastPriceVariance,
        Map<String, Double> volatilityParameters
) {
}
