package com.gridfolio.engine.service.optimizer;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Service;

/**
 * Subtracts the Sharpe ratio expected from the best of {@code numTrials} independent
 * zero-skill candidates, given the standard error implied by {@code observations}.
 */
@Service
public class DeflatedSharpeCalculator {

    private static final double EULER_MASCHERONI = 0.5772156649015329;

    private final NormalDistribution standardNormal = new NormalDistribution(null, 0.0, 1.0);

    public double calculate(double sharpe, int observations, int numTrials) {
        if (observations <= 1 || numTrials <= 1) {
            return sharpe;
        }
        double standardError = Math.sqrt((1.0 + 0.5 * sharpe * sharpe) / (observations - 1));
        return sharpe - standardError * expectedMaximum(numTrials);
    }

    /**
     * Expected maximum of {@code numTrials} standard normals.
     */
    double expectedMaximum(int numTrials) {
        return (1.0 - EULER_MASCHERONI) * standardNormal.inverseCumulativeProbability(1.0 - 1.0 / numTrials)
                + EULER_MASCHERONI * standardNormal.inverseCumulativeProbability(1.0 - 1.0 / (numTrials * Math.E));
    }
}
