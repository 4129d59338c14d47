package com.gridfolio.engine.service.risk;

import com.gridfolio.engine.exception.InsufficientDataException;
import com.gridfolio.engine.exception.InvalidConfigurationException;
import com.gridfolio.engine.model.TimeSeries;
import org.apache.commons.math3.stat.descriptive.moment.Variance;

import java.util.Map;

/**
 * Constant-variance model: the forecast is the unbiased sample variance at every step.
 */
public class SampleVarianceModel implements VolatilityModel {

    @Override
    public String name() {
        return "sample-variance";
    }

    @Override
    public FittedVolatilityModel fit(TimeSeries returns) {
        if (returns.size() < 2) {
            throw new InsufficientDataException("Too few returns for a sample variance", 2, returns.size());
        }
        double variance = new Variance(true).evaluate(returns.getValues());
        return new FittedVolatilityModel() {
            @Override
            public String name() {
                return SampleVarianceModel.this.name();
            }

            @Override
            public TimeSeries forecast(int steps) {
                if (steps < 0) {
                    throw new InvalidConfigurationException("Forecast steps must be non-negative but was " + steps);
                }
                return TimeSeries.constant(returns.getEnd().plusHours(1), steps, variance);
            }

            @Override
            public double unconditionalVariance() {
                return variance;
            }

            @Override
            public Map<String, Double> parameters() {
                return Map.of("variance", variance);
            }
        };
    }
}
