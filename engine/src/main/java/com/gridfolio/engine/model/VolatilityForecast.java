package com.gridfolio.engine.model;

import java.util.Map;

/**
 * Conditional variance path produced by a fitted volatility model.
 */
public record VolatilityForecast(
        String model,
        TimeSeries variance,
        double unconditionalVariance,
        Map<String, Double> parameters,
        boolean fallback
) {

    public VolatilityForecast {
        parameters = Map.copyOf(parameters);
    }

    public double meanVariance() {
        return variance.stream().average().orElse(unconditionalVariance);
    }

    public TimeSeries volatility() {
        return variance.map(Math::sqrt);
    }
}
