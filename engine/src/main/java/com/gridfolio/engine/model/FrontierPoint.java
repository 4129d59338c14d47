package com.gridfolio.engine.model;

public record FrontierPoint(double volatility, double expectedReturn, double[] weights, double sharpe) {

    public FrontierPoint {
        weights = weights.clone();
    }

    @Override
    public double[] weights() {
        return weights.clone();
    }
}
