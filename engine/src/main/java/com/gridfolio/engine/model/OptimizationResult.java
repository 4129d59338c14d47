package com.gridfolio.engine.model;

import java.util.List;

public record OptimizationResult(
        List<String> assets,
        List<FrontierPoint> frontier,
        FrontierPoint maxSharpePoint,
        Portfolio portfolio,
        double riskFreeRate,
        boolean covarianceRegularized,
        double diagonalLoading,
        double deflatedSharpe
) {

    public OptimizationResult {
        assets = List.copyOf(assets);
        frontier = List.copyOf(frontier);
    }
}
