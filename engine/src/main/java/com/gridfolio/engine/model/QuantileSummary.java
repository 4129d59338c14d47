package com.gridfolio.engine.model;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

public record QuantileSummary(double p10, double p50, double p90) {

    public static QuantileSummary of(double[] values) {
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(values);
        return new QuantileSummary(percentile.evaluate(10.0), percentile.evaluate(50.0), percentile.evaluate(90.0));
    }
}
