package com.gridfolio.engine.model;

import java.util.Arrays;

/**
 * Long-only box bounds per asset; weights always sum to one.
 */
public record PortfolioConstraints(double[] lowerBounds, double[] upperBounds) {

    public PortfolioConstraints {
        if (lowerBounds.length != upperBounds.length) {
            throw new IllegalArgumentException("Bound vectors differ in length: " + lowerBounds.length + " vs " + upperBounds.length);
        }
        lowerBounds = lowerBounds.clone();
        upperBounds = upperBounds.clone();
    }

    public static PortfolioConstraints uniform(int assets, double minWeight, double maxWeight) {
        double[] lower = new double[assets];
        double[] upper = new double[assets];
        Arrays.fill(lower, minWeight);
        Arrays.fill(upper, maxWeight);
        return new PortfolioConstraints(lower, upper);
    }

    public int size() {
        return lowerBounds.length;
    }

    @Override
    public double[] lowerBounds() {
        return lowerBounds.clone();
    }

    @Override
    public double[] upperBounds() {
        return upperBounds.clone();
    }

    public double lower(int index) {
        return lowerBounds[index];
    }

    public double upper(int index) {
        return upperBounds[index];
    }

    public boolean admits(double[] weights, double tolerance) {
        for (int i = 0; i < weights.length; i++) {
            if (weights[i] < lowerBounds[i] - tolerance || weights[i] > upperBounds[i] + tolerance) {
                return false;
            }
        }
        return true;
    }
}
