package com.gridfolio.engine.model;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.List;

/**
 * P10/P50/P90 across realizations at every timestamp.
 */
public record EnsembleBand(TimeSeries p10, TimeSeries p50, TimeSeries p90) {

    public static EnsembleBand across(List<TimeSeries> members) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("Ensemble band needs at least one member");
        }
        TimeSeries first = members.get(0);
        int length = first.size();
        double[] p10 = new double[length];
        double[] p50 = new double[length];
        double[] p90 = new double[length];
        double[] column = new double[members.size()];
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        for (int t = 0; t < length; t++) {
            for (int m = 0; m < members.size(); m++) {
                column[m] = members.get(m).get(t);
            }
            percentile.setData(column);
            p10[t] = percentile.evaluate(10.0);
            p50[t] = percentile.evaluate(50.0);
            p90[t] = percentile.evaluate(90.0);
        }
        return new EnsembleBand(
                new TimeSeries(first.getStart(), p10),
                new TimeSeries(first.getStart(), p50),
                new TimeSeries(first.getStart(), p90));
    }
}
