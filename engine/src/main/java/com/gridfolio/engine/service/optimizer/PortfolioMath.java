package com.gridfolio.engine.service.optimizer;

final class PortfolioMath {

    private PortfolioMath() {
    }

    static double expectedReturn(double[] weights, double[] expectedReturns) {
        double value = 0.0;
        for (int i = 0; i < weights.length; i++) {
            value += weights[i] * expectedReturns[i];
        }
        return value;
    }

    static double variance(double[] weights, double[][] covariance) {
        double value = 0.0;
        for (int i = 0; i < weights.length; i++) {
            for (int j = 0; j < weights.length; j++) {
                value += weights[i] * covariance[i][j] * weights[j];
            }
        }
        return Math.max(0.0, value);
    }

    static double volatility(double[] weights, double[][] covariance) {
        return Math.sqrt(variance(weights, covariance));
    }

    static double sharpe(double[] weights, double[] expectedReturns, double[][] covariance, double riskFreeRate) {
        double volatility = volatility(weights, covariance);
        return volatility == 0.0 ? 0.0 : (expectedReturn(weights, expectedReturns) - riskFreeRate) / volatility;
    }
}
