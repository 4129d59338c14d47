package com.gridfolio.engine.service.backtest;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.springframework.stereotype.Service;

/**
 * Historical tail risk of a return sample. Both figures are returns, so losses are negative.
 */
@Service
public class CvarService {

    /**
     * The {@code (1 - confidence)} quantile with linear interpolation between order statistics.
     */
    public double valueAtRisk(double[] returns, double confidence) {
        if (returns == null || returns.length == 0) {
            return 0.0;
        }
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(returns, 100.0 * (1.0 - confidence));
    }

    /**
     * Mean of the returns at or below the value at risk.
     */
    public double calculate(double[] returns, double confidence) {
        if (returns == null || returns.length == 0) {
            return 0.0;
        }
        double threshold = valueAtRisk(returns, confidence);
        double sum = 0.0;
        int count = 0;
        for (double value : returns) {
            if (value <= threshold) {
                sum += value;
                count++;
            }
        }
        return count == 0 ? threshold : sum / count;
    }
}
