package com.gridfolio.engine.model;

import com.gridfolio.engine.exception.InvalidConfigurationException;
import com.gridfolio.engine.exception.ModelFitException;

import java.util.List;

/**
 * Expected per-period returns and their covariance. {@code periodsPerYear} states the
 * period the raw figures refer to; {@link #annualized()} converts them to annual terms.
 */
public final class ReturnEstimate {

    private static final double SYMMETRY_TOLERANCE = 1e-10;

    private final List<String> assets;
    private final double[] expectedReturns;
    private final double[][] covariance;
    private final int periodsPerYear;

    public ReturnEstimate(List<String> assets, double[] expectedReturns, double[][] covariance, int periodsPerYear) {
        int n = assets.size();
        if (n == 0) {
            throw new InvalidConfigurationException("Return estimate needs at least one asset");
        }
        if (expectedReturns.length != n || covariance.length != n) {
            throw new InvalidConfigurationException("Return estimate dimensions disagree: " + n + " assets, "
                    + expectedReturns.length + " returns, " + covariance.length + " covariance rows");
        }
        if (periodsPerYear <= 0) {
            throw new InvalidConfigurationException("periodsPerYear must be > 0 but was " + periodsPerYear);
        }
        for (int i = 0; i < n; i++) {
            if (!Double.isFinite(expectedReturns[i])) {
                throw new ModelFitException("Expected return of " + assets.get(i) + " is not finite: " + expectedReturns[i]);
            }
            if (covariance[i].length != n) {
                throw new InvalidConfigurationException("Covariance row " + i + " has " + covariance[i].length + " columns, expected " + n);
            }
            for (int j = 0; j < n; j++) {
                if (!Double.isFinite(covariance[i][j])) {
                    throw new ModelFitException("Covariance[" + i + "][" + j + "] is not finite: " + covariance[i][j]);
                }
            }
        }
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double scale = Math.max(1.0, Math.max(Math.abs(covariance[i][j]), Math.abs(covariance[j][i])));
                if (Math.abs(covariance[i][j] - covariance[j][i]) > SYMMETRY_TOLERANCE * scale) {
                    throw new InvalidConfigurationException("Covariance is not symmetric at [" + i + "][" + j + "]: "
                            + covariance[i][j] + " vs " + covariance[j][i]);
                }
            }
        }
        this.assets = List.copyOf(assets);
        this.expectedReturns = expectedReturns.clone();
        this.covariance = copy(covariance);
        this.periodsPerYear = periodsPerYear;
    }

    public static ReturnEstimate fromVolatilities(List<String> assets, double[] expectedReturns, double[] volatilities,
                                                  double[][] correlation, int periodsPerYear) {
        int n = volatilities.length;
        double[][] covariance = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                covariance[i][j] = correlation[i][j] * volatilities[i] * volatilities[j];
            }
        }
        return new ReturnEstimate(assets, expectedReturns, covariance, periodsPerYear);
    }

    /**
     * Mean scaled by periods-per-year and covariance by periods-per-year.
     */
    public ReturnEstimate annualized() {
        if (periodsPerYear == 1) {
            return this;
        }
        int n = assets.size();
        double[] mean = new double[n];
        double[][] cov = new double[n][n];
        for (int i = 0; i < n; i++) {
            mean[i] = expectedReturns[i] * periodsPerYear;
            for (int j = 0; j < n; j++) {
                cov[i][j] = covariance[i][j] * periodsPerYear;
            }
        }
        return new ReturnEstimate(assets, mean, cov, 1);
    }

    public ReturnEstimate withCovariance(double[][] newCovariance) {
        return new ReturnEstimate(assets, expectedReturns, newCovariance, periodsPerYear);
    }

    public List<String> getAssets() {
        return assets;
    }

    public int size() {
        return assets.size();
    }

    public double[] getExpectedReturns() {
        return expectedReturns.clone();
    }

    public double[][] getCovariance() {
        return copy(covariance);
    }

    public int getPeriodsPerYear() {
        return periodsPerYear;
    }

    public double volatility(int index) {
        return Math.sqrt(Math.max(0.0, covariance[index][index]));
    }

    private static double[][] copy(double[][] source) {
        double[][] copy = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i].clone();
        }
        return copy;
    }
}
